package com.typerace.partyservice.games.typing.interfaces.http;

import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.interfaces.http.dto.PartySummary;
import com.typerace.partyservice.games.typing.service.PartyService;
import com.typerace.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 打字大厅 - 在线房间查询（只读，仅用于大厅展示与排障）
 *
 * 暂不做鉴权，前端可直接调用。
 */
@RestController
@RequestMapping("/api/parties")
@RequiredArgsConstructor
public class PartyQueryController {

    private final PartyService partyService;

    /**
     * 房间列表（按创建时间倒序）
     * @param state 可选，按阶段过滤（lobby / ready / running / finished）
     */
    @GetMapping
    public ApiResponse<List<PartySummary>> list(@RequestParam(value = "state", required = false) String state) {
        List<PartySummary> items = partyService.listParties().stream()
                .filter(s -> StringUtils.isBlank(state) || s.state().wireName().equalsIgnoreCase(state))
                .map(PartySummary::from)
                .toList();
        return ApiResponse.success(items);
    }

    /**
     * 单个房间的完整快照
     */
    @GetMapping("/{roomId}")
    public ResponseEntity<ApiResponse<PartySnapshot>> get(@PathVariable("roomId") String roomId) {
        if (StringUtils.isBlank(roomId)) {
            throw new IllegalArgumentException("roomId 不能为空");
        }
        return partyService.snapshot(roomId)
                .map(s -> ResponseEntity.ok(ApiResponse.success(s)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.notFound("房间不存在: " + roomId)));
    }
}
