package io.github.dredis.store;

/**
 * store中保存的值，一个key同一时刻只对应一种值。
 * hash和set的内容只在持有key的锁时修改，对外只暴露{@link #snapshot()}得到的不可变副本。
 */
public abstract class Value {

    public abstract ValueType getType();

    abstract Value snapshot();
}
