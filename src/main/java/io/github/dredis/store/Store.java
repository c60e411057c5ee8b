package io.github.dredis.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 所有连接共享的内存存储。
 * <p>
 * 每个操作对单个key是原子的，不同key上的操作互不阻塞；没有跨key的原子操作。
 * key的值类型与操作要求的类型不一致时抛出{@link WrongTypeException}，不会覆盖或转换原有的值。
 * key或field不存在不是错误。
 * </p>
 */
public interface Store {

    /**
     * @return key对应值的不可变快照
     */
    Optional<Value> get(ByteString key);

    /**
     * 无条件覆盖为字符串值，不论原来是什么类型。
     */
    void set(ByteString key, ByteString value);

    Optional<ByteString> getString(ByteString key);

    /**
     * key不存在时先创建空的hash。
     * @return field是否已经存在（被覆盖）
     */
    boolean hset(ByteString key, ByteString field, ByteString value);

    Optional<ByteString> hget(ByteString key, ByteString field);

    /**
     * @return 与fields位置一一对应的结果，不存在的field为{@link Optional#empty()}
     */
    List<Optional<ByteString>> hmget(ByteString key, List<ByteString> fields);

    /**
     * @return 所有field和value，key不存在时返回空列表
     */
    List<Map.Entry<ByteString, ByteString>> hgetall(ByteString key);

    /**
     * key不存在时先创建空的set。
     * @return 新加入的member个数，重复的member只计一次
     */
    int sadd(ByteString key, Collection<ByteString> members);

    boolean sismember(ByteString key, ByteString member);

    /**
     * @return key的个数
     */
    int size();
}
