package org.courtside.rotation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper factory so the store, the web layer and the CLI read and write
 * the same JSON.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {
        // Utility class
    }

    /**
     * Creates an ObjectMapper with Guava, JDK8 and java.time support. Dates are written
     * as ISO strings.
     *
     * @return a new ObjectMapper instance
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Same as {@link #create()} with indented output, for files meant to be read by people.
     */
    public static ObjectMapper createPretty() {
        return create().enable(SerializationFeature.INDENT_OUTPUT);
    }
}
