package com.typerace.partyservice.platform.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 入站消息的宽松解析。
 *
 * 客户端既可能直接发送 JSON 对象，也可能把 JSON 再编码成字符串发送；
 * 任何无法识别的载荷都返回 empty，由调用方丢弃，绝不向上抛出解析异常。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundMessageParser {

    private final ObjectMapper objectMapper;

    /**
     * 展开载荷：对象原样返回；字符串尝试再解析一次。
     */
    public Optional<JsonNode> unwrap(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Optional.empty();
        }
        if (payload.isObject()) {
            return Optional.of(payload);
        }
        if (payload.isTextual()) {
            try {
                JsonNode inner = objectMapper.readTree(payload.asText());
                return (inner != null && inner.isObject()) ? Optional.of(inner) : Optional.empty();
            } catch (JsonProcessingException e) {
                log.debug("入站字符串载荷不是合法 JSON，已丢弃: {}", e.getOriginalMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 解析 /app/message 信封；缺少 event 或 message.room 时返回 empty。
     */
    public Optional<InboundMessage> parseEnvelope(JsonNode payload) {
        Optional<JsonNode> root = unwrap(payload);
        if (root.isEmpty()) return Optional.empty();
        String event = text(root.get(), "event");
        JsonNode message = root.get().get("message");
        if (StringUtils.isBlank(event) || message == null || !message.isObject()) {
            return Optional.empty();
        }
        String room = text(message, "room");
        if (StringUtils.isBlank(room)) {
            return Optional.empty();
        }
        return Optional.of(new InboundMessage(event, room, message));
    }

    /**
     * 读取文本字段；字段缺失或不是文本时返回 null。
     */
    public static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v != null && v.isTextual()) ? v.asText() : null;
    }

    /**
     * 读取整数字段；接受整数或可解析为整数的字符串，其它情况返回 empty。
     */
    public static OptionalInt integer(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null) return OptionalInt.empty();
        if (v.isIntegralNumber() && v.canConvertToInt()) return OptionalInt.of(v.intValue());
        if (v.isNumber()) {
            double d = v.doubleValue();
            return (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) ? OptionalInt.of((int) d) : OptionalInt.empty();
        }
        if (v.isTextual()) {
            String s = StringUtils.trimToEmpty(v.asText());
            if (StringUtils.isNumeric(s) && s.length() <= 9) return OptionalInt.of(Integer.parseInt(s));
        }
        return OptionalInt.empty();
    }

    /**
     * 读取布尔字段；只接受 true/false（或其字符串形式）。
     */
    public static Optional<Boolean> bool(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null) return Optional.empty();
        if (v.isBoolean()) return Optional.of(v.booleanValue());
        if (v.isTextual()) {
            String s = v.asText();
            if ("true".equalsIgnoreCase(s)) return Optional.of(Boolean.TRUE);
            if ("false".equalsIgnoreCase(s)) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
