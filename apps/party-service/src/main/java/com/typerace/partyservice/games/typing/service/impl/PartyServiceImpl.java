package com.typerace.partyservice.games.typing.service.impl;

import com.typerace.partyservice.games.typing.application.PartyBroadcaster;
import com.typerace.partyservice.games.typing.application.PartyStateMachine;
import com.typerace.partyservice.games.typing.domain.constants.PartyEvents;
import com.typerace.partyservice.games.typing.domain.enums.PartyState;
import com.typerace.partyservice.games.typing.domain.model.Party;
import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.domain.model.Player;
import com.typerace.partyservice.games.typing.domain.model.PlayerView;
import com.typerace.partyservice.games.typing.domain.rule.ProgressRanking;
import com.typerace.partyservice.games.typing.interfaces.ws.dto.PartyMessages.ConnectionAck;
import com.typerace.partyservice.games.typing.service.PartyService;
import com.typerace.partyservice.games.typing.service.dto.JoinResult;
import com.typerace.partyservice.platform.ws.ConnectionInfo;
import com.typerace.partyservice.platform.ws.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;


@Slf4j
@Service
@RequiredArgsConstructor
public class PartyServiceImpl implements PartyService {

    // ====== 内存房间表 ======
    private final Map<String, Party> parties = new ConcurrentHashMap<>();

    /**
     * 房间锁：入站事件（clientInboundChannel 多线程）与计时回调（round-clock 线程）共用，
     * 保证每次“读-改-广播”完整执行，互不交错。
     */
    private final ReentrantLock lock = new ReentrantLock();

    private final ConnectionRegistry connectionRegistry;
    private final PartyStateMachine stateMachine;
    private final PartyBroadcaster broadcaster;

    @Override
    public ConnectionInfo connect(String connectionId) {
        return connectionRegistry.register(connectionId);
    }

    @Override
    public boolean acknowledge(String connectionId) {
        Optional<ConnectionInfo> info = connectionRegistry.lookup(connectionId);
        info.ifPresent(i -> broadcaster.sendToConnection(connectionId, PartyEvents.RES_CONN,
                new ConnectionAck(PartyState.LOBBY, unjoinedView(i))));
        return info.isPresent();
    }

    @Override
    public void disconnect(String connectionId) {
        lock.lock();
        try {
            connectionRegistry.lookup(connectionId)
                    .map(ConnectionInfo::getRoom)
                    .ifPresent(room -> leaveLocked(connectionId, room));
            connectionRegistry.unregister(connectionId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JoinResult> joinRoom(String roomId, String connectionId, String displayName) {
        if (StringUtils.isBlank(roomId)) {
            return Optional.empty();
        }
        lock.lock();
        try {
            ConnectionInfo conn = connectionRegistry.lookup(connectionId).orElse(null);
            if (conn == null) {
                log.debug("加入房间被忽略，连接不存在: connectionId={}, roomId={}", connectionId, roomId);
                return Optional.empty();
            }
            String name = StringUtils.isBlank(displayName) ? conn.getName() : displayName.trim();

            // 一个连接同一时刻只属于一个房间
            String previous = conn.getRoom();
            if (previous != null && !previous.equals(roomId)) {
                leaveLocked(connectionId, previous);
            }

            Party party = parties.computeIfAbsent(roomId, id -> {
                log.info("创建房间: roomId={}", id);
                return new Party(id, System.currentTimeMillis());
            });
            Player player = party.findPlayer(connectionId).orElse(null);
            if (player == null) {
                player = new Player(connectionId, roomId);
                player.setName(name);
                party.getPlayers().add(player);
                stateMachine.onMembershipChanged(party);
                log.info("玩家加入房间: roomId={}, connectionId={}, name={}, players={}",
                        roomId, connectionId, name, party.getPlayers().size());
            } else {
                player.setName(name);
            }
            connectionRegistry.bindRoom(connectionId, roomId, name);

            PlayerView view = PlayerView.of(player);
            PartySnapshot snap = PartySnapshot.of(party);
            broadcaster.sendToConnection(connectionId, PartyEvents.JOIN_ROOM_SUCCESS, view);
            broadcaster.publish(snap);
            return Optional.of(new JoinResult(view, snap));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void leaveRoom(String connectionId) {
        lock.lock();
        try {
            connectionRegistry.lookup(connectionId)
                    .map(ConnectionInfo::getRoom)
                    .ifPresent(room -> leaveLocked(connectionId, room));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean updateProgress(String roomId, String connectionId, int progress) {
        if (progress < 0 || progress > ProgressRanking.COMPLETE) {
            log.debug("进度越界，已丢弃: roomId={}, connectionId={}, progress={}", roomId, connectionId, progress);
            return false;
        }
        lock.lock();
        try {
            Party party = parties.get(roomId);
            if (party == null) return false;
            Player player = party.findPlayer(connectionId).orElse(null);
            if (player == null) return false;
            if (party.getState() != PartyState.RUNNING) {
                log.debug("非 running 阶段的进度上报被忽略: roomId={}, state={}", roomId, party.getState().wireName());
                return false;
            }
            if (ProgressRanking.recordProgress(party, player, progress)) {
                log.info("玩家完成: roomId={}, connectionId={}, place={}", roomId, connectionId, player.getPlace());
            }
            broadcaster.publish(PartySnapshot.of(party));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean updateReadiness(String roomId, String connectionId, boolean ready) {
        lock.lock();
        try {
            Party party = parties.get(roomId);
            if (party == null) return false;
            Player player = party.findPlayer(connectionId).orElse(null);
            if (player == null) return false;
            player.setReady(ready);
            stateMachine.onReadinessChanged(party);
            broadcaster.publish(PartySnapshot.of(party));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean startGame(String roomId, String connectionId) {
        lock.lock();
        try {
            Party party = parties.get(roomId);
            if (party == null) return false;
            if (party.findPlayer(connectionId).isEmpty()) {
                log.debug("非房间成员的开局指令被忽略: roomId={}, connectionId={}", roomId, connectionId);
                return false;
            }
            if (!stateMachine.start(party)) {
                return false;
            }
            broadcaster.publish(PartySnapshot.of(party));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean onRoundTimeout(String roomId, long roundSeq) {
        lock.lock();
        try {
            // 房间可能已被最后一名玩家离开而解散
            Party party = parties.get(roomId);
            if (party == null) {
                log.debug("回合到期时房间已解散: roomId={}", roomId);
                return false;
            }
            if (!stateMachine.expire(party, roundSeq)) {
                return false;
            }
            broadcaster.publish(PartySnapshot.of(party));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PlayerView> findInRoom(String roomId, String connectionId) {
        lock.lock();
        try {
            Party party = parties.get(roomId);
            if (party == null) return Optional.empty();
            return party.findPlayer(connectionId).map(PlayerView::of);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PartySnapshot> snapshot(String roomId) {
        lock.lock();
        try {
            return Optional.ofNullable(parties.get(roomId)).map(PartySnapshot::of);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PartySnapshot> listParties() {
        lock.lock();
        try {
            List<Party> sorted = new ArrayList<>(parties.values());
            sorted.sort(Comparator.comparingLong(Party::getCreatedAt).reversed());
            return sorted.stream().map(PartySnapshot::of).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 离开房间（调用方已持有锁）：最后一人离开则解散房间并停止计时，否则重新判定并广播。
     */
    private void leaveLocked(String connectionId, String roomId) {
        connectionRegistry.clearRoom(connectionId);
        Party party = parties.get(roomId);
        if (party == null || !party.removePlayer(connectionId)) {
            return;
        }
        log.info("玩家离开房间: roomId={}, connectionId={}, remaining={}",
                roomId, connectionId, party.getPlayers().size());
        if (party.isEmpty()) {
            parties.remove(roomId);
            stateMachine.dispose(party);
            log.info("房间已解散: roomId={}", roomId);
            return;
        }
        stateMachine.onMembershipChanged(party);
        broadcaster.publish(PartySnapshot.of(party));
    }

    private static PlayerView unjoinedView(ConnectionInfo info) {
        return new PlayerView(info.getConnectionId(), info.getName(), 0, null, null, false, info.getRoom());
    }
}
