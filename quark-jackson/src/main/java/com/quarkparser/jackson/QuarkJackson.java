package com.quarkparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the {@link ObjectMapper} behind {@link JacksonAstJsonProvider}.
 *
 * <p>Quark nodes are records, so their components are bound through constructor parameter
 * names. {@link AstModule} attaches the {@code "type"} discriminator to every node interface
 * and keeps {@code IfStatement.alternate} and the token of a juxtaposition call as explicit
 * {@code null}s; every other null is dropped. Token literals come back as {@code Long} for INT,
 * {@code Double} for FLOAT and {@code Integer} for WS, whatever number type the JSON used.</p>
 *
 * <pre>
 * ObjectMapper mapper = QuarkJackson.createObjectMapper();
 * CompilationUnit copy = mapper.readValue(mapper.writeValueAsString(unit), CompilationUnit.class);
 * </pre>
 */
public final class QuarkJackson {

    private QuarkJackson() {
    }

    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new ParameterNamesModule())
            .addModule(new AstModule())
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            // trees written by newer front ends may carry extra fields
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
