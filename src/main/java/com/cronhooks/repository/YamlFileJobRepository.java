package com.cronhooks.repository;

import com.cronhooks.model.Job;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Job repository backed by a YAML file of the form {@code jobs: [...]}.
 */
public class YamlFileJobRepository extends InMemoryJobRepository {
    private static final Logger logger = LoggerFactory.getLogger(YamlFileJobRepository.class);
    private final Path file;
    private final ObjectMapper objectMapper;

    public YamlFileJobRepository(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper(new YAMLFactory());
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    /**
     * Replaces the in-memory state with the file contents. A missing file yields an empty job list.
     */
    public void load() throws PersistenceException {
        if (!Files.exists(file)) {
            logger.info("Jobs file {} does not exist yet, starting with no jobs", file);
            lock.writeLock().lock();
            try {
                jobs.clear();
            } finally {
                lock.writeLock().unlock();
            }
            return;
        }

        JobFile contents;
        try {
            contents = objectMapper.readValue(file.toFile(), JobFile.class);
        } catch (IOException e) {
            throw new PersistenceException("failed to parse jobs file " + file, e);
        }

        lock.writeLock().lock();
        try {
            jobs.clear();
            if (contents != null && contents.getJobs() != null) {
                jobs.addAll(contents.getJobs());
            }
            logger.info("Loaded {} jobs from {}", jobs.size(), file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void persist() throws PersistenceException {
        JobFile contents = new JobFile(getAllJobs());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Replace the target in one move
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), contents);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Saved {} jobs to {}", contents.getJobs().size(), file);
        } catch (IOException e) {
            throw new PersistenceException("failed to write jobs file " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JobFile {
        private List<Job> jobs = new ArrayList<>();

        JobFile() {}

        JobFile(List<Job> jobs) {
            this.jobs = jobs;
        }

        public List<Job> getJobs() { return jobs; }
        public void setJobs(List<Job> jobs) { this.jobs = jobs; }
    }
}
