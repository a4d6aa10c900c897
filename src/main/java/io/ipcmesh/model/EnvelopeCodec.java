package io.ipcmesh.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.ipcmesh.util.Jsons;

public final class EnvelopeCodec {
    private static final JavaType ENVELOPE_TYPE = Jsons.wireMapper().getTypeFactory()
            .constructParametricType(IpcMessage.class, JsonNode.class);

    private EnvelopeCodec() {
    }

    public static IpcMessage<JsonNode> decode(String line) throws JsonProcessingException {
        IpcMessage<JsonNode> message = Jsons.wireMapper().readValue(line, ENVELOPE_TYPE);
        if (message == null) {
            throw JsonMappingException.from((JsonParser) null, "Envelope line is a JSON null");
        }
        return message;
    }

    public static String encode(IpcMessage<?> message) throws JsonProcessingException {
        return Jsons.wireMapper().writeValueAsString(message);
    }
}
