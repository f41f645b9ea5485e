package com.typerace.partyservice.platform.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 解析后的入站信封：{ event, message: { room, ... } }
 *
 * @param event   事件名
 * @param room    目标房间
 * @param message 原始消息体（各事件自行取字段）
 */
public record InboundMessage(String event, String room, JsonNode message) {
}
