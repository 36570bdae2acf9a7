package com.umitunal.pipeq.store;

import com.umitunal.pipeq.config.StorageConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed key-value store.
 *
 * RocksDB has no per-key TTL, so every value is wrapped in an {@link ExpiringValue}
 * envelope. Expired keys are invisible to reads and listings and are physically removed
 * either lazily or by {@link #purgeExpired()}. Keys are UTF-8 and ordered by the default
 * bytewise comparator, so listings come back in lexicographic order.
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksKeyValueStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle defaultHandle;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final Clock clock;

    public RocksKeyValueStore(StorageConfig config) throws StoreException {
        this(config, Clock.systemUTC());
    }

    public RocksKeyValueStore(StorageConfig config, Clock clock) throws StoreException {
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setMaxOpenFiles(-1);

        // Opening through descriptors is what binds the default column family handle
        List<ColumnFamilyDescriptor> descriptors =
                List.of(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            this.transactionDB = OptimisticTransactionDB.open(
                    dbOptions, config.getDataDirectory(), descriptors, handles);
            this.defaultHandle = handles.get(0);
        } catch (RocksDBException e) {
            dbOptions.close();
            cfOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw new StoreException("Cannot open RocksDB at " + config.getDataDirectory(), e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // Listing scans should not evict hot point-lookup blocks
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        log.info("Opened RocksDB store at {}", config.getDataDirectory());
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) throws StoreException {
        KeyValueStore.checkTtl(ttl);
        try {
            transactionDB.put(defaultHandle, writeOpts, key.getBytes(UTF_8), wrap(value, ttl));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to write key " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) throws StoreException {
        byte[] rawKey = key.getBytes(UTF_8);
        try {
            byte[] raw = transactionDB.get(defaultHandle, rawKey);
            if (raw == null) {
                return Optional.empty();
            }
            ExpiringValue stored = unwrap(key, raw);
            if (stored.isExpired(clock.millis())) {
                transactionDB.delete(defaultHandle, writeOpts, rawKey);
                return Optional.empty();
            }
            return Optional.of(stored.getValue());
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read key " + key, e);
        }
    }

    @Override
    public void delete(String key) throws StoreException {
        try {
            transactionDB.delete(defaultHandle, writeOpts, key.getBytes(UTF_8));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to delete key " + key, e);
        }
    }

    @Override
    public List<String> list(String prefix, int limit) throws StoreException {
        List<String> keys = new ArrayList<>();
        byte[] rawPrefix = prefix.getBytes(UTF_8);
        long now = clock.millis();

        try (final RocksIterator iter = transactionDB.newIterator(defaultHandle, scanReadOpts)) {
            iter.seek(rawPrefix);

            while (iter.isValid() && keys.size() < limit) {
                byte[] key = iter.key();
                if (!startsWith(key, rawPrefix)) {
                    break;
                }
                String decodedKey = new String(key, UTF_8);
                if (!unwrap(decodedKey, iter.value()).isExpired(now)) {
                    keys.add(decodedKey);
                }
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to list prefix " + prefix, e);
        }
        return keys;
    }

    /**
     * Atomic create-if-absent using an optimistic transaction. A commit conflict means
     * another writer touched the key after our read, so we lost the race.
     */
    @Override
    public boolean putIfAbsent(String key, byte[] value, Duration ttl) throws StoreException {
        KeyValueStore.checkTtl(ttl);
        byte[] rawKey = key.getBytes(UTF_8);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] current = txn.getForUpdate(readOpts, defaultHandle, rawKey, true);

            if (current != null && !unwrap(key, current).isExpired(clock.millis())) {
                return false;
            }

            txn.put(defaultHandle, rawKey, wrap(value, ttl));
            txn.commit();
            return true;
        } catch (RocksDBException e) {
            if (isConflict(e)) {
                log.debug("Lost create-if-absent race on {}", key);
                return false;
            }
            throw new StoreException("Failed conditional write on " + key, e);
        }
    }

    /**
     * Physically remove expired keys. Values whose envelope cannot be read are removed too.
     *
     * @return number of keys removed
     */
    public long purgeExpired() throws StoreException {
        long purged = 0;
        long now = clock.millis();

        try (final RocksIterator iter = transactionDB.newIterator(defaultHandle, scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {

            iter.seekToFirst();

            while (iter.isValid()) {
                if (expiredOrCorrupt(iter.key(), iter.value(), now)) {
                    batch.delete(defaultHandle, iter.key());
                    purged++;

                    if (purged % 1000 == 0) {
                        transactionDB.write(writeOpts, batch);
                        batch.clear();
                    }
                }
                iter.next();
            }

            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new StoreException("Failed to purge expired keys", e);
        }

        if (purged > 0) {
            log.info("Purged {} expired keys", purged);
        }
        return purged;
    }

    @Override
    public void close() {
        scanReadOpts.close();
        txnOpts.close();
        writeOpts.close();
        defaultHandle.close();
        transactionDB.close();
        dbOptions.close();
        cfOptions.close();
        blockCache.close();
        bloomFilter.close();
    }

    private byte[] wrap(byte[] value, Duration ttl) {
        return new ExpiringValue(clock.millis() + ttl.toMillis(), value).serialize();
    }

    private static ExpiringValue unwrap(String key, byte[] raw) throws StoreException {
        try {
            return ExpiringValue.deserialize(raw);
        } catch (RuntimeException e) {
            throw new StoreException("Corrupt value envelope for " + key, e);
        }
    }

    private static boolean expiredOrCorrupt(byte[] rawKey, byte[] raw, long now) {
        String key = new String(rawKey, UTF_8);
        try {
            return unwrap(key, raw).isExpired(now);
        } catch (StoreException e) {
            log.warn("Dropping {} during purge", key, e);
            return true;
        }
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        return key.length >= prefix.length
                && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }
}
