package com.di.enrichment.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (enrichment.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "enrichment.sql")
public class SqlQueriesProperties {

    private Cache cache = new Cache();
    private Task task = new Task();
    private Config config = new Config();

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Task getTask() { return task; }
    public void setTask(Task task) { this.task = task; }
    public Config getConfig() { return config; }
    public void setConfig(Config config) { this.config = config; }

    public static class Cache {
        private String findByKey;
        private String insert;
        private String update;
        private String countAll;
        private String countExpired;
        private String countByDataType;
        private String deleteExpired;
        public String getFindByKey() { return findByKey; }
        public void setFindByKey(String findByKey) { this.findByKey = findByKey; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
        public String getCountAll() { return countAll; }
        public void setCountAll(String countAll) { this.countAll = countAll; }
        public String getCountExpired() { return countExpired; }
        public void setCountExpired(String countExpired) { this.countExpired = countExpired; }
        public String getCountByDataType() { return countByDataType; }
        public void setCountByDataType(String countByDataType) { this.countByDataType = countByDataType; }
        public String getDeleteExpired() { return deleteExpired; }
        public void setDeleteExpired(String deleteExpired) { this.deleteExpired = deleteExpired; }
    }

    public static class Task {
        private String insert;
        private String update;
        private String findById;
        private String findRecentByEntity;
        private String countByStatus;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindRecentByEntity() { return findRecentByEntity; }
        public void setFindRecentByEntity(String findRecentByEntity) { this.findRecentByEntity = findRecentByEntity; }
        public String getCountByStatus() { return countByStatus; }
        public void setCountByStatus(String countByStatus) { this.countByStatus = countByStatus; }
    }

    public static class Config {
        private String findByEntityKind;
        public String getFindByEntityKind() { return findByEntityKind; }
        public void setFindByEntityKind(String findByEntityKind) { this.findByEntityKind = findByEntityKind; }
    }
}
