package com.llmhub.controller;

import com.llmhub.dto.BridgeSnapshot;
import com.llmhub.dto.DefaultResponse;
import com.llmhub.dto.ModelRecord;
import com.llmhub.service.bridge.BridgeHealthService;
import com.llmhub.service.bridge.ModelDiscoveryService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/bridge")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bridge.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeStatusController {

    private final BridgeHealthService bridgeHealthService;
    private final ModelDiscoveryService modelDiscoveryService;

    /**
     * 브리지 Raw 계측 스냅샷
     * - 연결/복구/리소스/예측 정비 상태를 판단 없이 반환
     */
    @GetMapping("/status")
    public ResponseEntity<DefaultResponse<BridgeSnapshot>> status() {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        bridgeHealthService.getSnapshot()
                )
        );
    }

    @GetMapping("/models")
    public ResponseEntity<DefaultResponse<List<ModelRecord>>> models() {
        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        modelDiscoveryService.getModels()
                )
        );
    }

    /**
     * 디스커버리 강제 1회 실행
     * - 업스트림 실패는 GlobalExceptionHandler 에서 503 으로 변환
     */
    @PostMapping("/models/refresh")
    public ResponseEntity<DefaultResponse<Map<String, Integer>>> refresh() throws Exception {
        int count = modelDiscoveryService.force();

        return ResponseEntity.ok(
                DefaultResponse.success(
                        HttpStatus.OK.value(),
                        Map.of("models", count)
                )
        );
    }
}
