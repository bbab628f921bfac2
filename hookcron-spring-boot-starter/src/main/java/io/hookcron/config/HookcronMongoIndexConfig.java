package io.hookcron.config;

import io.hookcron.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the hookcron module.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code hookcron.ensure-indexes-on-startup=true}. In production they are usually managed by
 * DB migrations / ops scripts.
 *
 * <h3>Indexes (collection: {@code webhook_jobs})</h3>
 * <ul>
 *   <li><b>idx_created_at</b>: { createdAt: -1 }
 *       <br/>Used by listing jobs newest first.</li>
 *   <li><b>idx_status</b>: { status: 1 }
 *       <br/>Used by operators inspecting failed or running jobs.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.webhook_jobs.createIndex({ createdAt: -1 }, { name: "idx_created_at" });
 * db.webhook_jobs.createIndex({ status: 1 }, { name: "idx_status" });
 * </pre>
 */
public class HookcronMongoIndexConfig {

    public static final String IDX_CREATED_AT = "idx_created_at";
    public static final String IDX_STATUS = "idx_status";

    private final MongoTemplate mongoTemplate;

    public HookcronMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Ensure the indexes above exist.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(createdAtIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(statusIndex());
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_CREATED_AT);
    }

    public static Index statusIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .named(IDX_STATUS);
    }
}
