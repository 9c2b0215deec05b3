package com.gurukul.karmaLedger.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gurukul.karmaLedger.util.JsonFileLoader;
import com.gurukul.karmaLedger.util.UserIdMasker;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;

/**
 * Read-only stand-in for the users collection.
 *
 * Loads user documents from a JSON array on the classpath; each element carries an
 * "_id", a "role" and a "balances" sub-document. Documents are returned as BSON
 * {@link Document}s, the same shape the production store hands back.
 */
@Repository
public class UserDocumentRepository {

    private static final Logger log = LoggerFactory.getLogger(UserDocumentRepository.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String DEFAULT_USERS_RESOURCE = "data/users.json";

    private final String usersResource;

    public UserDocumentRepository(@Value("${karma.users.resource:" + DEFAULT_USERS_RESOURCE + "}") String usersResource) {
        this.usersResource = usersResource;
    }

    /**
     * Finds a user document by its "_id".
     *
     * @param userId the id to match
     * @return the matching Document, or null if not found or the resource cannot be read
     */
    public Document findById(String userId) {
        if (userId == null) {
            return null;
        }
        try {
            JsonNode users = JsonFileLoader.loadAsJsonNode(usersResource);
            if (!users.isArray()) {
                log.error("JSON file {} does not contain an array", usersResource);
                return null;
            }

            for (JsonNode user : users) {
                JsonNode idNode = user.get("_id");
                if (idNode != null && userId.equals(idNode.asText())) {
                    return Document.parse(objectMapper.writeValueAsString(user));
                }
            }

            log.debug("No user document found - userId: {}", UserIdMasker.mask(userId));
            return null;

        } catch (IOException e) {
            log.error("Failed to load users resource: {}", usersResource, e);
            return null;
        }
    }
}
