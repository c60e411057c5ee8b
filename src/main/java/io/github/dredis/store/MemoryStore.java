package io.github.dredis.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.MapMaker;
import com.google.common.collect.Maps;
import lombok.NonNull;

/**
 * {@link Store}的内存实现。
 * <p>
 * 数据保存在{@link ConcurrentHashMap}中，每个key有自己的锁，操作期间持有该key的锁。
 * 锁放在weak value的map里，没有线程持有时可以被回收，不会随key的数量无限增长。
 * 没有全局锁，不同key上的操作不会互相等待。
 * </p>
 */
public class MemoryStore implements Store {
    private final ConcurrentMap<ByteString, Value> entries = new ConcurrentHashMap<>();

    private final ConcurrentMap<ByteString, Lock> locks = new MapMaker()
            .weakValues()
            .makeMap();

    @Override
    public Optional<Value> get(@NonNull ByteString key) {
        return withLock(key, () -> {
            Value v = entries.get(key);
            return v == null ? Optional.empty() : Optional.of(v.snapshot());
        });
    }

    @Override
    public void set(@NonNull ByteString key, @NonNull ByteString value) {
        withLock(key, () -> entries.put(key, new StringValue(value)));
    }

    @Override
    public Optional<ByteString> getString(@NonNull ByteString key) {
        return withLock(key, () -> {
            StringValue v = lookup(key, ValueType.STRING, StringValue.class);
            return v == null ? Optional.empty() : Optional.of(v.getBytes());
        });
    }

    @Override
    public boolean hset(@NonNull ByteString key, @NonNull ByteString field, @NonNull ByteString value) {
        return withLock(key, () -> {
            HashValue hash = lookup(key, ValueType.HASH, HashValue.class);
            if (hash == null) {
                hash = new HashValue();
                entries.put(key, hash);
            }
            return hash.put(field, value);
        });
    }

    @Override
    public Optional<ByteString> hget(@NonNull ByteString key, @NonNull ByteString field) {
        return withLock(key, () -> {
            HashValue hash = lookup(key, ValueType.HASH, HashValue.class);
            return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
        });
    }

    @Override
    public List<Optional<ByteString>> hmget(@NonNull ByteString key, @NonNull List<ByteString> fields) {
        return withLock(key, () -> {
            HashValue hash = lookup(key, ValueType.HASH, HashValue.class);
            List<Optional<ByteString>> values = new ArrayList<>(fields.size());
            for (ByteString field : fields) {
                values.add(hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field)));
            }
            return values;
        });
    }

    @Override
    public List<Map.Entry<ByteString, ByteString>> hgetall(@NonNull ByteString key) {
        return withLock(key, () -> {
            HashValue hash = lookup(key, ValueType.HASH, HashValue.class);
            if (hash == null) {
                return ImmutableList.of();
            }
            ImmutableList.Builder<Map.Entry<ByteString, ByteString>> builder = ImmutableList.builder();
            hash.view().forEach((field, value) -> builder.add(Maps.immutableEntry(field, value)));
            return builder.build();
        });
    }

    @Override
    public int sadd(@NonNull ByteString key, @NonNull Collection<ByteString> members) {
        return withLock(key, () -> {
            SetValue set = lookup(key, ValueType.SET, SetValue.class);
            if (set == null) {
                set = new SetValue();
                entries.put(key, set);
            }
            int added = 0;
            for (ByteString member : members) {
                if (set.add(member)) {
                    added++;
                }
            }
            return added;
        });
    }

    @Override
    public boolean sismember(@NonNull ByteString key, @NonNull ByteString member) {
        return withLock(key, () -> {
            SetValue set = lookup(key, ValueType.SET, SetValue.class);
            return set != null && set.contains(member);
        });
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * 必须持有key的锁时调用。
     * @return key对应的值，不存在时返回null
     * @throws WrongTypeException 值的类型不是expected
     */
    private <T extends Value> T lookup(ByteString key, ValueType expected, Class<T> type) {
        Value v = entries.get(key);
        if (v == null) {
            return null;
        }
        if (v.getType() != expected) {
            throw new WrongTypeException(expected, v.getType());
        }
        return type.cast(v);
    }

    private <T> T withLock(ByteString key, Supplier<T> action) {
        Lock lock = getLockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Lock getLockFor(ByteString key) {
        return locks.computeIfAbsent(key, (k) -> new ReentrantLock());
    }
}
