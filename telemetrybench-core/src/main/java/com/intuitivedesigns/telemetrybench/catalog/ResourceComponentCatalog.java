/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.telemetrybench.config.BenchConfig;
import com.intuitivedesigns.telemetrybench.data.FieldValues;
import com.intuitivedesigns.telemetrybench.errors.ConfigurationException;
import com.intuitivedesigns.telemetrybench.model.ComponentDescriptor;
import com.intuitivedesigns.telemetrybench.model.FieldDescriptor;
import com.intuitivedesigns.telemetrybench.model.ReservedFields;
import com.intuitivedesigns.telemetrybench.model.TopicDescriptor;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.apache.avro.generic.GenericData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads component definitions from {@code components/<name>.json}.
 *
 * <p>Each file is {@code {"name": ..., "indexed": ..., "topics": [<Avro record schema>, ...]}}.
 * The reserved envelope fields are prepended to every topic schema, and the record is moved into
 * the {@code lsst.sal.<component>} namespace.</p>
 *
 * <p>Definitions are read from {@code catalog.dir} when set, otherwise from the classpath.</p>
 */
public final class ResourceComponentCatalog implements ComponentCatalog {

    private static final Logger log = LoggerFactory.getLogger(ResourceComponentCatalog.class);

    public static final String CFG_CATALOG_DIR = "catalog.dir";
    private static final String RESOURCE_DIR = "components/";
    private static final String NAMESPACE_PREFIX = "lsst.sal.";

    private final ObjectMapper json = new ObjectMapper();
    private final Path directory;
    private final Map<String, ComponentDescriptor> cache = new ConcurrentHashMap<>();

    public ResourceComponentCatalog(BenchConfig config) {
        final String dir = Objects.requireNonNull(config, "config").getString(CFG_CATALOG_DIR, null);
        this.directory = (dir == null) ? null : Path.of(dir);
    }

    @Override
    public ComponentDescriptor load(String componentName) {
        Objects.requireNonNull(componentName, "componentName");
        return cache.computeIfAbsent(componentName, this::read);
    }

    private ComponentDescriptor read(String componentName) {
        final String file = componentName + ".json";
        final JsonNode root;
        try (InputStream in = open(file)) {
            if (in == null) {
                throw new ConfigurationException("Unknown component '" + componentName + "': no " + RESOURCE_DIR + file
                        + (directory == null ? " on the classpath" : " under " + directory));
            }
            root = json.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read component definition " + file, e);
        }

        final String name = root.path("name").asText(componentName);
        if (!name.equals(componentName)) {
            throw new ConfigurationException("Component file " + file + " declares name '" + name + "'");
        }
        final boolean indexed = root.path("indexed").asBoolean(false);

        final JsonNode topicsNode = root.path("topics");
        if (!topicsNode.isArray() || topicsNode.isEmpty()) {
            throw new ConfigurationException("Component " + componentName + " defines no topics");
        }

        final Map<String, TopicDescriptor> topics = new LinkedHashMap<>();
        for (JsonNode topicNode : topicsNode) {
            final TopicDescriptor t = toTopic(componentName, indexed, topicNode);
            if (topics.put(t.logicalName(), t) != null) {
                throw new ConfigurationException("Duplicate topic " + t.logicalName() + " in component " + componentName);
            }
        }

        log.info("Loaded component {} (indexed={}) with {} topics", componentName, indexed, topics.size());
        return new ComponentDescriptor(componentName, indexed, topics);
    }

    private InputStream open(String file) throws IOException {
        if (directory != null) {
            final Path p = directory.resolve(file);
            return Files.isRegularFile(p) ? Files.newInputStream(p) : null;
        }
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = ResourceComponentCatalog.class.getClassLoader();
        return cl.getResourceAsStream(RESOURCE_DIR + file);
    }

    private TopicDescriptor toTopic(String componentName, boolean indexed, JsonNode topicNode) {
        final Schema declared;
        try {
            declared = new Schema.Parser().parse(json.writeValueAsString(topicNode));
        } catch (SchemaParseException | IOException e) {
            throw new ConfigurationException("Invalid topic schema in component " + componentName + ": " + e.getMessage(), e);
        }
        if (declared.getType() != Schema.Type.RECORD) {
            throw new ConfigurationException("Topic schemas must be records in component " + componentName);
        }

        final Schema wire = withReservedFields(componentName, indexed, declared);
        final String logicalName = declared.getName();
        return new TopicDescriptor(
                componentName,
                logicalName,
                TopicDescriptor.wireName(componentName, logicalName),
                wire,
                indexed,
                describe(wire)
        );
    }

    static Schema withReservedFields(String componentName, boolean indexed, Schema declared) {
        final List<Schema.Field> fields = new ArrayList<>();
        fields.add(new Schema.Field(ReservedFields.SND_STAMP, Schema.create(Schema.Type.DOUBLE),
                "Time of data transmission (seconds since the epoch)", 0.0));
        fields.add(new Schema.Field(ReservedFields.RCV_STAMP, Schema.create(Schema.Type.DOUBLE),
                "Time of data reception (seconds since the epoch)", 0.0));
        fields.add(new Schema.Field(ReservedFields.SEQ_NUM, Schema.create(Schema.Type.INT),
                "Sequence number, starting at 1", 0));
        if (indexed) {
            fields.add(new Schema.Field(ReservedFields.INDEX, Schema.create(Schema.Type.INT),
                    "Index of the component instance", 0));
        }

        for (Schema.Field f : declared.getFields()) {
            if (ReservedFields.isReserved(f.name())) {
                throw new ConfigurationException("Topic " + declared.getName() + " redefines reserved field " + f.name());
            }
            fields.add(new Schema.Field(f, f.schema()));
        }

        return Schema.createRecord(declared.getName(), declared.getDoc(), NAMESPACE_PREFIX + componentName, false, fields);
    }

    static List<FieldDescriptor> describe(Schema wire) {
        final List<FieldDescriptor> out = new ArrayList<>(wire.getFields().size());
        for (Schema.Field f : wire.getFields()) {
            final Object def = f.hasDefaultValue() ? FieldValues.normalize(GenericData.get().getDefaultValue(f)) : null;
            final Schema fs = f.schema();
            if (fs.getType() == Schema.Type.ARRAY) {
                final int length = (def instanceof List<?> l) ? l.size() : 0;
                out.add(FieldDescriptor.array(f.name(), fs.getElementType().getType(), length, def));
            } else {
                out.add(FieldDescriptor.scalar(f.name(), fs.getType(), def));
            }
        }
        return out;
    }
}
