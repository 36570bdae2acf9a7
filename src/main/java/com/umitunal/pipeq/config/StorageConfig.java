package com.umitunal.pipeq.config;

/**
 * Configuration for the backing key-value store.
 */
public class StorageConfig {

    /**
     * Which store implementation to open.
     */
    public enum Backend {
        ROCKSDB,
        MEMORY
    }

    private final Backend backend;
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.backend = builder.backend;
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public Backend getBackend() { return backend; }
    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    /**
     * Volatile store, nothing touches disk.
     */
    public static StorageConfig inMemory() {
        return new Builder(null).withBackend(Backend.MEMORY).build();
    }

    @Override
    public String toString() {
        return String.format("StorageConfig{backend=%s, dir='%s', durable=%s}",
                backend, dataDirectory, durableWrites);
    }

    public static class Builder {
        private final String dataDirectory;
        private Backend backend = Backend.ROCKSDB;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 2;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 32;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Default: ROCKSDB
         */
        public Builder withBackend(Backend backend) {
            this.backend = backend;
            return this;
        }

        /**
         * Enable durable writes (fsync on every write).
         * Queue state must survive a process crash, so this defaults to true.
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            if (backend == Backend.ROCKSDB && (dataDirectory == null || dataDirectory.isBlank())) {
                throw new PipelineConfigurationException("RocksDB backend requires a data directory");
            }
            return new StorageConfig(this);
        }
    }
}
