package com.vaultpost.crypto;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

/**
 * JSON codec for byte arrays written as arrays of unsigned 8-bit integers
 * ({@code [0, 255, 17]}) instead of Jackson's default base64 string.
 *
 * Envelopes and key backups use this representation on the wire and in storage.
 */
public final class UnsignedBytes {

    private UnsignedBytes() {
    }

    public static final class Serializer extends JsonSerializer<byte[]> {

        @Override
        public void serialize(byte[] value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartArray(value, value.length);
            for (byte b : value) {
                gen.writeNumber(b & 0xFF);
            }
            gen.writeEndArray();
        }
    }

    public static final class Deserializer extends JsonDeserializer<byte[]> {

        @Override
        public byte[] deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.getCodec().readTree(p);
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isArray()) {
                throw JsonMappingException.from(p, "expected an array of unsigned bytes");
            }

            byte[] out = new byte[node.size()];
            for (int i = 0; i < out.length; i++) {
                JsonNode n = node.get(i);
                if (!n.canConvertToInt() || n.asInt() < 0 || n.asInt() > 255) {
                    throw JsonMappingException.from(p, "expected unsigned byte (0-255) at index " + i);
                }
                out[i] = (byte) n.asInt();
            }
            return out;
        }
    }
}
