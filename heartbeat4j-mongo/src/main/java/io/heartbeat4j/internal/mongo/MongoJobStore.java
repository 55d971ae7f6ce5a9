package io.heartbeat4j.internal.mongo;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.heartbeat4j.core.JobStore;
import io.heartbeat4j.core.PersistResult;
import io.heartbeat4j.core.ScheduledJob;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for cron jobs ({@code cron_jobs} collection).
 *
 * <p>One document per job name. Upserts overwrite the schedule fields and keep the original
 * {@code createdAt}, which decides precedence between rows sharing a task type.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Insert or update a job by name.
     *
     * <p>Returns CREATED when the document did not exist and was upserted,
     * UPDATED when an existing document was updated.
     */
    @Override
    public PersistResult upsert(ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");

        Update update = new Update()
                .set("cronSpec", job.cronSpec())
                .set("taskType", job.taskType());
        if (job.description() != null) {
            update.set("description", job.description());
        } else {
            update.unset("description");
        }
        Instant createdAt = job.createdAt() != null ? job.createdAt() : clock.instant();
        update.setOnInsert("createdAt", createdAt);

        UpdateResult result = mongoTemplate.upsert(byName(job.name()), update, CronJobDocument.class);
        return result.getUpsertedId() != null ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        CronJobDocument doc = mongoTemplate.findById(name, CronJobDocument.class);
        return Optional.ofNullable(doc).map(MongoJobStore::toJob);
    }

    @Override
    public List<ScheduledJob> findAll() {
        Query query = new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        List<CronJobDocument> docs = mongoTemplate.find(query, CronJobDocument.class);

        List<ScheduledJob> jobs = new ArrayList<>(docs.size());
        for (CronJobDocument doc : docs) {
            jobs.add(toJob(doc));
        }
        return jobs;
    }

    @Override
    public long deleteByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        DeleteResult result = mongoTemplate.remove(byName(name), CronJobDocument.class);
        return result.getDeletedCount();
    }

    private static Query byName(String name) {
        return new Query(Criteria.where("_id").is(name));
    }

    private static ScheduledJob toJob(CronJobDocument doc) {
        return new ScheduledJob(
                doc.getName(),
                doc.getCronSpec(),
                doc.getTaskType(),
                doc.getDescription(),
                doc.getCreatedAt()
        );
    }
}
