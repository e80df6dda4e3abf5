package com.careerhub.matchservice.games.careermatch.interfaces.http;

import com.careerhub.web.common.ApiResponse;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 大厅房间列表
 */
@RestController
@RequestMapping("/api/career-match/rooms")
@RequiredArgsConstructor
public class RoomListController {

    private final CareerMatchService matchService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<PerpetualRoom>>> list() {
        return ResponseEntity.ok(ApiResponse.success(matchService.listRooms()));
    }
}
