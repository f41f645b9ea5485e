package com.typerace.partyservice.games.typing.application;

import com.typerace.partyservice.config.TypingProperties;
import com.typerace.partyservice.games.typing.domain.challenge.ChallengeTextGenerator;
import com.typerace.partyservice.games.typing.domain.enums.PartyState;
import com.typerace.partyservice.games.typing.domain.enums.StartPolicy;
import com.typerace.partyservice.games.typing.domain.model.Party;
import com.typerace.partyservice.games.typing.domain.model.Player;
import com.typerace.partyservice.games.typing.domain.rule.ProgressRanking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 房间状态机
 * -------------------------------------------------
 * 阶段流转：
 *   lobby ⇄ ready      由准备状态驱动（全员准备 → ready，任一人取消 → lobby）
 *   * → starting       由开局指令驱动（受 StartPolicy 约束）
 *   starting → running 进入 starting 时立即完成，并登记回合计时
 *   running → finished 只由回合计时到期驱动
 *   finished → lobby/ready 下一轮准备
 *
 * 进入钩子（只在真正发生切换时执行一次）：
 *   ready    ：重置名次/进度，生成新挑战文本，写入名义时长；
 *   starting ：发放新的回合序号，清空准备标记，登记计时并转入 running；
 *   finished ：按进度补齐名次。
 *
 * 不负责加锁与广播，由调用方（PartyService）在房间锁内调用、调用后广播快照。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartyStateMachine {

    private final ChallengeTextGenerator challengeTextGenerator;
    private final RoundClockCoordinator roundClock;
    private final TypingProperties properties;

    /** 回合序号发号器（全服务递增），同名房间解散重建后也不会与旧计时的版本号重合 */
    private final AtomicLong roundSequence = new AtomicLong();

    /**
     * 准备状态变化后重新判定阶段（回合进行中不切换）。
     * @return 阶段是否发生变化
     */
    public boolean onReadinessChanged(Party party) {
        if (!party.getState().acceptsReadinessTransition()) {
            return false;
        }
        return transitionIfChanged(party, party.allReady() ? PartyState.READY : PartyState.LOBBY);
    }

    /**
     * 成员变化（加入/离开）后重新判定阶段，只在 lobby / ready 之间切换，
     * finished 保持结算结果直到有人重新准备。
     */
    public boolean onMembershipChanged(Party party) {
        PartyState s = party.getState();
        if (s != PartyState.LOBBY && s != PartyState.READY) {
            return false;
        }
        return transitionIfChanged(party, party.allReady() ? PartyState.READY : PartyState.LOBBY);
    }

    /**
     * 开局指令。
     * @return 被 StartPolicy 拒绝时返回 false
     */
    public boolean start(Party party) {
        PartyState from = party.getState();
        StartPolicy policy = properties.getRound().getStartPolicy();
        if (!policy.allows(from)) {
            log.debug("开局被拒绝: roomId={}, state={}, policy={}", party.getName(), from.wireName(), policy);
            return false;
        }
        if (from != PartyState.READY) {
            // 越权开局：补做 ready 的回合准备，避免沿用上一轮的名次与文本
            prepareRound(party);
        }
        transition(party, PartyState.STARTING);
        return true;
    }

    /**
     * 回合到期。
     * @param roundSeq 计时登记时的回合序号
     * @return 房间不在 running 或回合序号不匹配（过期计时）时返回 false
     */
    public boolean expire(Party party, long roundSeq) {
        if (party.getState() != PartyState.RUNNING || party.getRoundSeq() != roundSeq) {
            log.debug("忽略过期的回合计时: roomId={}, state={}, roundSeq={}, expected={}",
                    party.getName(), party.getState().wireName(), party.getRoundSeq(), roundSeq);
            return false;
        }
        transition(party, PartyState.FINISHED);
        return true;
    }

    /**
     * 房间解散：停止计时。
     */
    public void dispose(Party party) {
        roundClock.stop(party.getName());
    }

    private boolean transitionIfChanged(Party party, PartyState target) {
        if (party.getState() == target) {
            return false;
        }
        transition(party, target);
        return true;
    }

    private void transition(Party party, PartyState target) {
        PartyState from = party.getState();
        party.setState(target);
        log.info("房间阶段切换: roomId={}, {} -> {}", party.getName(), from.wireName(), target.wireName());
        switch (target) {
            case READY -> prepareRound(party);
            case STARTING -> onEnterStarting(party);
            case FINISHED -> onEnterFinished(party);
            default -> {
            }
        }
    }

    private void prepareRound(Party party) {
        ProgressRanking.resetRoundState(party);
        party.setTargetString(challengeTextGenerator.next());
        party.setTimerDurationMs(properties.getRound().getDurationMs());
        party.setDeadlineEpochMs(null);
        party.setFinished(false);
    }

    private void onEnterStarting(Party party) {
        party.setRoundSeq(roundSequence.incrementAndGet());
        for (Player p : party.getPlayers()) {
            p.setReady(false);
        }
        long duration = properties.getRound().getDurationMs();
        party.setTimerDurationMs(duration);
        party.setDeadlineEpochMs(roundClock.startRound(party.getName(), party.getRoundSeq(), duration));
        transition(party, PartyState.RUNNING);
    }

    private void onEnterFinished(Party party) {
        ProgressRanking.finalizeRanking(party);
        party.setFinished(true);
        party.setDeadlineEpochMs(null);
    }
}
