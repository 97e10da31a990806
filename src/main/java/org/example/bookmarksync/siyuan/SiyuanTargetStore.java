package org.example.bookmarksync.siyuan;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.bookmarksync.config.SyncProperties;
import org.example.bookmarksync.model.TargetCollection;
import org.example.bookmarksync.store.DocumentAttributes;
import org.example.bookmarksync.store.TargetStore;
import org.example.bookmarksync.store.TargetStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TargetStore} backed by the SiYuan kernel HTTP API. Collections are notebooks and
 * documents are doc blocks. Every endpoint answers with a {@code {code, msg, data}}
 * envelope where {@code code == 0} means success.
 */
@Service
public class SiyuanTargetStore implements TargetStore {

    private static final Logger log = LoggerFactory.getLogger(SiyuanTargetStore.class);

    static final String API_LS_NOTEBOOKS = "/api/notebook/lsNotebooks";
    static final String API_GET_BLOCK_ATTRS = "/api/attr/getBlockAttrs";
    static final String API_SET_BLOCK_ATTRS = "/api/attr/setBlockAttrs";
    static final String API_REMOVE_DOC_BY_ID = "/api/filetree/removeDocByID";
    static final String API_CREATE_DOC_WITH_MD = "/api/filetree/createDocWithMd";
    static final String API_UPLOAD_ASSET = "/api/asset/upload";
    static final String API_SQL_QUERY = "/api/query/sql";

    private final RestClient restClient;

    public SiyuanTargetStore(RestClient.Builder restClientBuilder, SyncProperties properties) {
        SyncProperties.Siyuan siyuan = properties.getSiyuan();
        restClientBuilder.baseUrl(siyuan.getBaseUrl());
        if (siyuan.getApiToken() != null && !siyuan.getApiToken().isBlank()) {
            restClientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + siyuan.getApiToken());
        }
        this.restClient = restClientBuilder.build();
    }

    @Override
    public Optional<String> findDocumentByExternalId(String collectionId, String externalId) {
        String stmt = """
            SELECT b.id
            FROM blocks AS b
            JOIN attributes AS a ON b.id = a.block_id
            WHERE b.box = '%s' AND b.type = 'd' AND a.name = '%s' AND a.value = '%s'
            LIMIT 1""".formatted(sqlLiteral(collectionId), DocumentAttributes.EXTERNAL_ID, sqlLiteral(externalId));

        log.debug("Searching for existing doc for Karakeep ID {} in notebook {}", externalId, collectionId);
        JsonNode response;
        try {
            response = post(API_SQL_QUERY, Map.of("stmt", stmt));
        } catch (RestClientException e) {
            log.error("Network error during SQL lookup for Karakeep ID {}", externalId, e);
            throw new TargetStoreException("SiYuan lookup failed for Karakeep ID " + externalId, e);
        }

        if (!isOk(response)) {
            log.error("SQL query failed {} for Karakeep ID {}", describe(response), externalId);
            return Optional.empty();
        }

        JsonNode rows = response.path("data");
        if (rows.isArray() && !rows.isEmpty()) {
            String id = rows.get(0).path("id").asText("");
            if (!id.isBlank()) {
                log.debug("Found existing document {} for Karakeep ID {}", id, externalId);
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Map<String, String>> getAttributes(String documentId) {
        try {
            JsonNode response = post(API_GET_BLOCK_ATTRS, Map.of("id", documentId));
            if (!isOk(response) || !response.path("data").isObject()) {
                log.warn("Could not get attributes for block {} {}", documentId, describe(response));
                return Optional.empty();
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = response.get("data").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                attributes.put(field.getKey(), field.getValue().asText());
            }
            return Optional.of(attributes);
        } catch (RestClientException e) {
            log.error("Network error getting attributes for block {}", documentId, e);
            return Optional.empty();
        }
    }

    @Override
    public void setAttributes(String documentId, Map<String, String> attributes) {
        try {
            JsonNode response = post(API_SET_BLOCK_ATTRS, Map.of("id", documentId, "attrs", attributes));
            if (isOk(response)) {
                log.debug("Set {} attributes on doc {}", attributes.size(), documentId);
            } else {
                log.error("Failed setting attributes for doc {} {}", documentId, describe(response));
            }
        } catch (RestClientException e) {
            log.error("Network error setting attributes for doc {}", documentId, e);
        }
    }

    @Override
    public Optional<String> createDocument(String collectionId, String path, String markdown) {
        try {
            JsonNode response = post(API_CREATE_DOC_WITH_MD,
                Map.of("notebook", collectionId, "path", path, "markdown", markdown));
            String docId = isOk(response) ? response.path("data").asText("") : "";
            if (docId.isBlank()) {
                log.error("Failed to create document at {}:{} {}", collectionId, path, describe(response));
                return Optional.empty();
            }
            log.info("Created document {} at {}", docId, path);
            return Optional.of(docId);
        } catch (RestClientException e) {
            log.error("Error creating document at {}:{}", collectionId, path, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean deleteDocument(String documentId) {
        try {
            JsonNode response = post(API_REMOVE_DOC_BY_ID, Map.of("id", documentId));
            if (isOk(response)) {
                log.info("Deleted document {}", documentId);
                return true;
            }
            log.error("Failed to delete document {} {}", documentId, describe(response));
            return false;
        } catch (RestClientException e) {
            log.error("Network error deleting document {}", documentId, e);
            return false;
        }
    }

    @Override
    public Optional<String> uploadAsset(String collectionId, String assetDirectory, String fileName,
                                        String contentType, byte[] content) {
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentDispositionFormData("file[]", fileName);
        fileHeaders.setContentType(toMediaType(contentType));

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("assetsDirPath", assetDirectory);
        if (collectionId != null && !collectionId.isBlank()) {
            parts.add("notebook", collectionId);
        }
        parts.add("file[]", new HttpEntity<>(new NamedByteArrayResource(content, fileName), fileHeaders));

        try {
            log.info("Uploading asset '{}' ({} KB) to SiYuan", fileName, String.format("%.1f", content.length / 1024.0));
            JsonNode response = restClient.post()
                .uri(API_UPLOAD_ASSET)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(parts)
                .retrieve()
                .body(JsonNode.class);

            JsonNode uploaded = response == null ? null : response.path("data").path("succMap").get(fileName);
            if (isOk(response) && uploaded != null && !uploaded.asText("").isBlank()) {
                log.info("Asset uploaded to SiYuan: {}", uploaded.asText());
                return Optional.of(uploaded.asText());
            }
            log.error("Failed to upload asset '{}' {} errFiles={}", fileName, describe(response),
                response == null ? "n/a" : response.path("data").path("errFiles"));
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Error uploading asset '{}'", fileName, e);
            return Optional.empty();
        }
    }

    @Override
    public List<TargetCollection> listCollections() {
        JsonNode response;
        try {
            response = post(API_LS_NOTEBOOKS, Map.of());
        } catch (RestClientException e) {
            throw new TargetStoreException("Failed to list SiYuan notebooks", e);
        }
        if (!isOk(response)) {
            throw new TargetStoreException("Failed to list SiYuan notebooks " + describe(response));
        }

        List<TargetCollection> collections = new ArrayList<>();
        for (JsonNode notebook : response.path("data").path("notebooks")) {
            if (notebook.path("closed").asBoolean(false)) {
                continue;
            }
            collections.add(new TargetCollection(notebook.path("id").asText(), notebook.path("name").asText()));
        }
        return collections;
    }

    private JsonNode post(String path, Object body) {
        return restClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(JsonNode.class);
    }

    private static boolean isOk(JsonNode response) {
        return response != null && response.path("code").asInt(-1) == 0;
    }

    private static String describe(JsonNode response) {
        if (response == null) {
            return "[no response]";
        }
        return "[" + response.path("code").asText("n/a") + "] " + response.path("msg").asText("");
    }

    static String sqlLiteral(String value) {
        return value == null ? "" : value.replace("'", "''");
    }

    private static MediaType toMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparseable content type '{}', sending as octet-stream", contentType);
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String fileName;

        NamedByteArrayResource(byte[] content, String fileName) {
            super(content);
            this.fileName = fileName;
        }

        @Override
        public String getFilename() {
            return fileName;
        }
    }
}
