package com.helix.guardrails.knowledge.impl;

import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.helix.guardrails.configuration.AppProperties;
import com.helix.guardrails.configuration.PineconeProperties;
import com.helix.guardrails.exception.TransientIoException;
import com.helix.guardrails.knowledge.MetadataFilter;
import com.helix.guardrails.knowledge.VectorStore;
import com.helix.guardrails.model.CallContext;
import com.helix.guardrails.model.ServiceType;
import com.helix.guardrails.model.VectorMatch;
import com.helix.guardrails.util.ExternalCallLogger;
import io.pinecone.clients.Index;
import io.pinecone.proto.FetchResponse;
import io.pinecone.proto.Vector;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pinecone-backed vector store. Each collection is a namespace of one index; the chunk
 * text travels in the {@code content} metadata field.
 *
 * <p>Pinecone reports cosine similarity as {@code score}; matches are returned with
 * {@code distance = 1 - score}.
 */
@Slf4j
@Service
public class PineconeVectorStore implements VectorStore {

    static final String CONTENT_KEY = "content";

    private final Index index;
    private final PineconeProperties pinecone;

    public PineconeVectorStore(Index index, AppProperties props) {
        this.index = index;
        this.pinecone = props.getPinecone();
    }

    @Override
    public void add(String collection,
                    List<String> ids,
                    List<String> texts,
                    List<List<Double>> vectors,
                    List<Map<String, Object>> metadatas) {
        int n = ids.size();
        if (texts.size() != n || vectors.size() != n || (metadatas != null && metadatas.size() != n)) {
            throw new IllegalArgumentException("ids, texts, vectors and metadatas must have the same size");
        }
        if (n == 0) {
            return;
        }

        List<VectorWithUnsignedIndices> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (metadatas != null && metadatas.get(i) != null) {
                metadata.putAll(metadatas.get(i));
            }
            metadata.put(CONTENT_KEY, texts.get(i));
            records.add(new VectorWithUnsignedIndices(ids.get(i), toFloats(vectors.get(i)), toStruct(metadata), null));
        }

        String namespace = namespace(collection);
        int batchSize = pinecone.getUpsertBatchSize();
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "upsert", log);
        ctx.logRequest(null, "Namespace", namespace, "Vectors", n);
        try {
            for (int i = 0; i < n; i += batchSize) {
                int end = Math.min(i + batchSize, n);
                index.upsert(records.subList(i, end), namespace);
                log.debug("Upserted batch {}-{} of {}", i, end, n);
            }
            ctx.logResponse(null);
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.PINECONE, "Pinecone upsert into '" + collection + "' failed", e);
        }
    }

    @Override
    public List<VectorMatch> query(String collection, List<Double> vector, int k, MetadataFilter filter) {
        Struct pineconeFilter = toPineconeFilter(filter);

        String namespace = namespace(collection);
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "query", log);
        ctx.logRequest(null, "Namespace", namespace, "TopK", k, "Filter", filter);

        QueryResponseWithUnsignedIndices response;
        try {
            response = index.query(
                    k,
                    toFloats(vector),
                    null,    // sparseIndices
                    null,    // sparseValues
                    null,    // id
                    namespace,
                    pineconeFilter,
                    false,   // includeValues
                    true     // includeMetadata
            );
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.PINECONE, "Pinecone query on '" + collection + "' failed", e);
        }

        List<VectorMatch> matches = new ArrayList<>();
        if (response != null && response.getMatchesList() != null) {
            for (ScoredVectorWithUnsignedIndices match : response.getMatchesList()) {
                Map<String, Object> metadata = fromStruct(match.getMetadata());
                Object content = metadata.remove(CONTENT_KEY);
                matches.add(new VectorMatch(match.getId(), content == null ? "" : content.toString(),
                        metadata, 1.0 - match.getScore()));
            }
        }
        ctx.logResponse(null, "Matches", matches.size());
        return matches;
    }

    @Override
    public Optional<VectorMatch> get(String collection, String id) {
        String namespace = namespace(collection);
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "fetch", log);
        ctx.logRequest(null, "Namespace", namespace, "Id", id);

        FetchResponse response;
        try {
            response = index.fetch(List.of(id), namespace);
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new TransientIoException(ServiceType.PINECONE, "Pinecone fetch of '" + id + "' failed", e);
        }

        Vector vector = response == null ? null : response.getVectorsMap().get(id);
        ctx.logResponse(null, "Found", vector != null);
        if (vector == null) {
            return Optional.empty();
        }
        Map<String, Object> metadata = vector.hasMetadata() ? fromStruct(vector.getMetadata()) : new LinkedHashMap<>();
        Object content = metadata.remove(CONTENT_KEY);
        return Optional.of(new VectorMatch(id, content == null ? "" : content.toString(), metadata, 0.0));
    }

    @Override
    public void addRepoMap(String repoUrl, String fileTree, String signatures, List<Double> vector) {
        add(REPO_MAPS,
                List.of(repoUrl),
                List.of(VectorStore.repoMapContent(repoUrl, fileTree, signatures)),
                List.of(vector),
                List.of(Map.of("repo_url", repoUrl)));
    }

    String namespace(String collection) {
        return pinecone.getNamespacePrefix() + collection;
    }

    /**
     * Equality filter in Pinecone's syntax: a single {@code $eq} condition, or an
     * {@code $and} of them when there are several; null for no filter.
     */
    static Struct toPineconeFilter(MetadataFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        List<Struct> conditions = new ArrayList<>();
        for (Map.Entry<String, Object> e : filter.conditions().entrySet()) {
            Struct eq = Struct.newBuilder().putFields("$eq", toValue(e.getValue())).build();
            conditions.add(Struct.newBuilder()
                    .putFields(e.getKey(), Value.newBuilder().setStructValue(eq).build())
                    .build());
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        ListValue.Builder all = ListValue.newBuilder();
        conditions.forEach(c -> all.addValues(Value.newBuilder().setStructValue(c).build()));
        return Struct.newBuilder()
                .putFields("$and", Value.newBuilder().setListValue(all).build())
                .build();
    }

    static Struct toStruct(Map<String, Object> metadata) {
        Struct.Builder builder = Struct.newBuilder();
        metadata.forEach((key, value) -> {
            if (value != null) {
                builder.putFields(key, toValue(value));
            }
        });
        return builder.build();
    }

    static Map<String, Object> fromStruct(Struct struct) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (struct == null) {
            return result;
        }
        struct.getFieldsMap().forEach((key, value) -> result.put(key, fromValue(value)));
        return result;
    }

    private static Value toValue(Object value) {
        if (value == null) {
            return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        }
        if (value instanceof Number number) {
            return Value.newBuilder().setNumberValue(number.doubleValue()).build();
        }
        if (value instanceof Boolean bool) {
            return Value.newBuilder().setBoolValue(bool).build();
        }
        return Value.newBuilder().setStringValue(value.toString()).build();
    }

    private static Object fromValue(Value value) {
        return switch (value.getKindCase()) {
            case NUMBER_VALUE -> value.getNumberValue();
            case BOOL_VALUE -> value.getBoolValue();
            case STRING_VALUE -> value.getStringValue();
            case STRUCT_VALUE -> fromStruct(value.getStructValue());
            case LIST_VALUE -> value.getListValue().getValuesList().stream()
                    .map(PineconeVectorStore::fromValue)
                    .toList();
            default -> null;
        };
    }

    private static List<Float> toFloats(List<Double> vector) {
        return vector.stream()
                .map(Double::floatValue)
                .toList();
    }
}
