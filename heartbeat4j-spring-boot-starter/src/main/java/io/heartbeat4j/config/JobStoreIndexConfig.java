package io.heartbeat4j.config;

import io.heartbeat4j.internal.mongo.CronJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the persisted job store.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code heartbeat4j.ensure-indexes-on-startup=true}.
 * The job name is the document {@code _id}, so name uniqueness needs no extra index.
 *
 * <h3>Indexes (collection: {@code cron_jobs})</h3>
 * <ul>
 *   <li><b>idx_task_type_created</b>: { taskType: 1, createdAt: 1 }
 *       <br/>Used by the system-job lookup and duplicate task type resolution.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.cron_jobs.createIndex({ taskType: 1, createdAt: 1 }, { name: "idx_task_type_created" });
 * </pre>
 */
public class JobStoreIndexConfig {

    public static final String IDX_TASK_TYPE_CREATED = "idx_task_type_created";

    private final MongoTemplate mongoTemplate;

    public JobStoreIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(taskTypeCreatedIndex());
    }

    /**
     * Keys: taskType ASC, createdAt ASC
     */
    public static Index taskTypeCreatedIndex() {
        return new Index()
                .on("taskType", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_TASK_TYPE_CREATED);
    }
}
