package com.typerace.partyservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 连接注册表：connectionId -> {@link ConnectionInfo}。
 *
 * 同一个连接只会存在一条登记记录；重复登记返回已有记录。
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final ConcurrentMap<String, ConnectionInfo> connections = new ConcurrentHashMap<>();

    /**
     * 连接建立时登记默认记录（名字为 Anonymous、无房间）。
     */
    public ConnectionInfo register(String connectionId) {
        ConnectionInfo info = connections.computeIfAbsent(connectionId,
                id -> new ConnectionInfo(id, System.currentTimeMillis()));
        log.debug("连接登记: connectionId={}, online={}", connectionId, connections.size());
        return info;
    }

    /**
     * 连接断开时移除登记。
     */
    public Optional<ConnectionInfo> unregister(String connectionId) {
        if (connectionId == null) return Optional.empty();
        ConnectionInfo removed = connections.remove(connectionId);
        if (removed != null) {
            log.debug("连接注销: connectionId={}, online={}", connectionId, connections.size());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ConnectionInfo> lookup(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(connections.get(connectionId));
    }

    /**
     * 记录连接加入的房间与展示名。
     * @return 连接不存在时返回 false
     */
    public boolean bindRoom(String connectionId, String roomId, String name) {
        ConnectionInfo info = connections.get(connectionId);
        if (info == null) return false;
        info.setRoom(roomId);
        info.setName(name);
        return true;
    }

    /**
     * 清除连接的房间归属（离开房间后调用）。
     */
    public void clearRoom(String connectionId) {
        ConnectionInfo info = connections.get(connectionId);
        if (info != null) info.setRoom(null);
    }

    public int size() {
        return connections.size();
    }
}
