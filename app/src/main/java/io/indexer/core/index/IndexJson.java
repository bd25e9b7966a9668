package io.indexer.core.index;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.indexer.core.error.StorageUnavailableException;
import io.indexer.core.protocol.Address;
import io.indexer.core.protocol.Hash;

import java.io.IOException;

/** JSON encoding for secondary index records. */
final class IndexJson {
    private static final ObjectMapper JSON = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .registerModule(new SimpleModule("chain-types")
                    .addSerializer(Address.class, new JsonSerializer<Address>() {
                        @Override
                        public void serialize(Address value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                            gen.writeString(value.hex());
                        }
                    })
                    .addDeserializer(Address.class, new JsonDeserializer<Address>() {
                        @Override
                        public Address deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                            return Address.fromHex(p.getValueAsString());
                        }
                    })
                    .addSerializer(Hash.class, new JsonSerializer<Hash>() {
                        @Override
                        public void serialize(Hash value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                            gen.writeString(value.hex());
                        }
                    })
                    .addDeserializer(Hash.class, new JsonDeserializer<Hash>() {
                        @Override
                        public Hash deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                            return Hash.fromHex(p.getValueAsString());
                        }
                    }));

    private IndexJson() {}

    static byte[] write(Object record) {
        try {
            return JSON.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + record.getClass().getSimpleName(), e);
        }
    }

    static <T> T read(byte[] bytes, Class<T> type) {
        try {
            return JSON.readValue(bytes, type);
        } catch (IOException e) {
            throw new StorageUnavailableException("corrupt " + type.getSimpleName() + " record", e);
        }
    }
}
