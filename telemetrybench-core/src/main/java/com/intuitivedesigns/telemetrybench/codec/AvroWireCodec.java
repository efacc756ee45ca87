/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.codec;

import com.intuitivedesigns.telemetrybench.data.FieldValues;
import com.intuitivedesigns.telemetrybench.driver.Futures;
import com.intuitivedesigns.telemetrybench.errors.MessageException;
import com.intuitivedesigns.telemetrybench.errors.ValidationException;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistration;
import com.intuitivedesigns.telemetrybench.registry.SchemaRegistry;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confluent wire format: magic byte {@code 0}, 4-byte big-endian schema id, Avro binary body.
 *
 * <p>Encoding uses the id obtained at registration time and never consults the registry. Decoding
 * resolves the embedded id through the registry (cached there).</p>
 */
public final class AvroWireCodec {

    public static final byte MAGIC_BYTE = 0;
    public static final int HEADER_SIZE = 5;

    private final SchemaRegistry registry;
    private final Map<Schema, GenericDatumWriter<GenericRecord>> writers = new ConcurrentHashMap<>();
    private final Map<Integer, GenericDatumReader<GenericRecord>> readers = new ConcurrentHashMap<>();

    public AvroWireCodec(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @throws ValidationException if a value does not fit the topic schema
     */
    public byte[] encode(SchemaRegistration registration, TopicDescriptor topic, Map<String, Object> fields) {
        final Schema schema = topic.schema();
        final GenericData data = GenericData.get();
        final GenericData.Record record = new GenericData.Record(schema);
        for (Schema.Field f : schema.getFields()) {
            final Object value = fields.containsKey(f.name())
                    ? fields.get(f.name())
                    : (f.hasDefaultValue() ? data.getDefaultValue(f) : null);
            if (!data.validate(f.schema(), value)) {
                throw new ValidationException(topic.wireName(), f.name(), value == null
                        ? "no value and no default"
                        : "value " + value + " does not match " + f.schema());
            }
            record.put(f.pos(), value);
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        out.write(MAGIC_BYTE);
        out.write(ByteBuffer.allocate(4).putInt(registration.schemaId()).array(), 0, 4);
        final BinaryEncoder encoder = EncoderFactory.get().directBinaryEncoder(out, null);
        try {
            writers.computeIfAbsent(schema, s -> new GenericDatumWriter<>(s)).write(record, encoder);
            encoder.flush();
        } catch (IOException | AvroRuntimeException e) {
            throw new ValidationException(topic.wireName(), null, "cannot serialize: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    /**
     * @return the decoded message; fails with {@link MessageException} on a malformed payload
     */
    public CompletableFuture<DecodedMessage> decode(byte[] payload) {
        if (payload == null || payload.length < HEADER_SIZE) {
            return Futures.failed(new MessageException("Message too short for wire header: "
                    + (payload == null ? "null" : payload.length + " bytes")));
        }
        if (payload[0] != MAGIC_BYTE) {
            return Futures.failed(new MessageException("Unknown magic byte " + payload[0]));
        }
        final int schemaId = ByteBuffer.wrap(payload, 1, 4).getInt();
        return registry.schemaById(schemaId).thenApply(schema -> {
            final GenericDatumReader<GenericRecord> reader = readers.computeIfAbsent(schemaId, id -> new GenericDatumReader<>(schema));
            final BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(payload, HEADER_SIZE, payload.length - HEADER_SIZE, null);
            try {
                return new DecodedMessage(schemaId, FieldValues.toFieldMap(reader.read(null, decoder)));
            } catch (IOException | AvroRuntimeException e) {
                throw new MessageException("Failed to decode message with schema id " + schemaId + ": " + e.getMessage(), e);
            }
        });
    }
}
