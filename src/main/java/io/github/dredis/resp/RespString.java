package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 单行文本类型（simple string和error）的公共部分，内容不能包含\r和\n，统一按UTF-8编码。
 */
@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String content;

    RespString(@NonNull String content) {
        Preconditions.checkArgument(content.indexOf('\r') == -1, "resp simple string can not contain \\r");
        Preconditions.checkArgument(content.indexOf('\n') == -1, "resp simple string can not contain \\n");
        this.content = content;
    }

    abstract char getFirstChar();

    @Override
    public byte[] toBytes() {
        return (getFirstChar() + content + "\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
