package com.typerace.partyservice.games.typing.domain.rule;

import com.typerace.partyservice.games.typing.domain.model.Party;
import com.typerace.partyservice.games.typing.domain.model.Player;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 进度与名次规则（纯函数，不做广播）。
 *
 * <ul>
 *   <li>完成顺序即名次：先到 100 的玩家拿 1 名；</li>
 *   <li>名次只分配一次，到期结算不会重排已完成的玩家；</li>
 *   <li>名次取自房间本回合的发号计数，已拿名次的玩家中途离开，名次也不会被复用；</li>
 *   <li>未完成的玩家按进度降序补齐名次，进度相同按加入顺序。</li>
 * </ul>
 */
public final class ProgressRanking {

    public static final int COMPLETE = 100;

    private ProgressRanking() {
    }

    /**
     * 记录进度；达到 100 且尚无名次时分配下一个名次。
     * @param party    所在房间（提供本回合名次计数）
     * @param player   上报进度的玩家
     * @param progress 新进度
     * @return 本次是否新分配了名次
     */
    public static boolean recordProgress(Party party, Player player, int progress) {
        player.setProgress(progress);
        if (progress >= COMPLETE && !player.hasPlace()) {
            player.setPlace(party.nextPlace());
            return true;
        }
        return false;
    }

    /**
     * 回合到期结算：为所有尚无名次的玩家按进度降序补齐名次（稳定排序，平局按列表顺序）。
     */
    public static void finalizeRanking(Party party) {
        List<Player> unplaced = new ArrayList<>();
        for (Player p : party.getPlayers()) {
            if (!p.hasPlace()) unplaced.add(p);
        }
        // List.sort 为稳定排序
        unplaced.sort(Comparator.comparingInt(Player::getProgress).reversed());
        for (Player p : unplaced) {
            p.setPlace(party.nextPlace());
        }
    }

    /**
     * 新回合前清空名次、进度与名次计数。
     */
    public static void resetRoundState(Party party) {
        for (Player p : party.getPlayers()) {
            p.setPlace(null);
            p.setProgress(0);
        }
        party.setPlacesAssigned(0);
    }
}
