package com.libragraph.medvault.core.dao;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.medvault.types.ClassificationTags;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

/**
 * Binds {@link ClassificationTags} as a JSON array string.
 */
public class ClassificationTagsArgumentFactory extends AbstractArgumentFactory<ClassificationTags> {

    private final ObjectMapper objectMapper;

    public ClassificationTagsArgumentFactory(ObjectMapper objectMapper) {
        super(Types.VARCHAR);
        this.objectMapper = objectMapper;
    }

    @Override
    protected Argument build(ClassificationTags value, ConfigRegistry config) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value.values());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode classification tags", e);
        }
        return (position, statement, ctx) -> statement.setString(position, json);
    }
}
