package io.github.dredis.store;

import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = false)
@ToString
public final class SetValue extends Value {
    private final Set<ByteString> members;

    SetValue() {
        this.members = new HashSet<>();
    }

    private SetValue(ImmutableSet<ByteString> members) {
        this.members = members;
    }

    @Override
    public ValueType getType() {
        return ValueType.SET;
    }

    public Set<ByteString> getMembers() {
        return ImmutableSet.copyOf(members);
    }

    boolean contains(ByteString member) {
        return members.contains(member);
    }

    /**
     * @return member是否是新加入的
     */
    boolean add(ByteString member) {
        return members.add(member);
    }

    @Override
    Value snapshot() {
        return new SetValue(ImmutableSet.copyOf(members));
    }
}
