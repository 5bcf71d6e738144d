package com.thetaguard.api.controller;

import com.thetaguard.api.dto.request.AccountSnapshotDto;
import com.thetaguard.api.dto.request.AdmissionRequestDto;
import com.thetaguard.api.dto.request.FillRequest;
import com.thetaguard.api.dto.request.LifecycleRequest;
import com.thetaguard.api.dto.request.SizingRequest;
import com.thetaguard.api.dto.request.TickRequest;
import com.thetaguard.api.dto.response.PositionResponse;
import com.thetaguard.api.dto.response.SizingResponse;
import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.correlation.CorrelationSummary;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.domain.model.AccountSnapshot;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.domain.model.AdmissionRequest;
import com.thetaguard.domain.model.MarketSnapshot;
import com.thetaguard.emergency.ProtocolDirective;
import com.thetaguard.engine.DecisionEngine;
import com.thetaguard.engine.TickReport;
import com.thetaguard.lifecycle.LifecycleDecision;
import com.thetaguard.mapper.DecisionDtoMapper;
import com.thetaguard.marketdata.MarketSnapshotAssembler;
import com.thetaguard.phase.PhaseManager;
import com.thetaguard.phase.PhaseMetrics;
import com.thetaguard.sizing.KellyPositionSizer;
import com.thetaguard.sizing.SizingResult;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the decision core. The core never places orders; these endpoints only answer
 * admission, sizing and defense questions and accept fills back from the executor.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/decisions/admission} -- evaluate (and optionally reserve) a candidate</li>
 *   <li>{@code DELETE /api/decisions/reservations/{positionId}} -- release an unfilled reservation</li>
 *   <li>{@code POST /api/decisions/sizing} -- Kelly-capped risk fraction</li>
 *   <li>{@code POST /api/decisions/lifecycle/{positionId}} -- evaluate a tracked position</li>
 *   <li>{@code POST /api/decisions/lifecycle/{positionId}/defense} -- plan the roll or close</li>
 *   <li>{@code POST /api/decisions/tick} -- run one full decision cycle</li>
 *   <li>{@code GET /api/decisions/protocol} -- directive in force, or for a given regime</li>
 *   <li>{@code POST /api/decisions/fills} -- apply an execution report</li>
 *   <li>{@code GET /api/decisions/correlation/summary} -- group usage and risk score</li>
 *   <li>{@code GET /api/decisions/phase?equity=} -- phase metrics for an equity value</li>
 *   <li>{@code GET /api/decisions/status} -- halt state</li>
 *   <li>{@code POST /api/decisions/resume} -- resume after a halt</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionController {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    private final DecisionEngine decisionEngine;
    private final KellyPositionSizer kellyPositionSizer;
    private final PhaseManager phaseManager;
    private final CorrelationAdmissionController correlationAdmissionController;
    private final MarketSnapshotAssembler marketSnapshotAssembler;
    private final Clock decisionClock;

    private final DecisionDtoMapper decisionDtoMapper = Mappers.getMapper(DecisionDtoMapper.class);

    public DecisionController(
            DecisionEngine decisionEngine,
            KellyPositionSizer kellyPositionSizer,
            PhaseManager phaseManager,
            CorrelationAdmissionController correlationAdmissionController,
            MarketSnapshotAssembler marketSnapshotAssembler,
            Clock decisionClock) {
        this.decisionEngine = decisionEngine;
        this.kellyPositionSizer = kellyPositionSizer;
        this.phaseManager = phaseManager;
        this.correlationAdmissionController = correlationAdmissionController;
        this.marketSnapshotAssembler = marketSnapshotAssembler;
        this.decisionClock = decisionClock;
    }

    // ========================
    // ADMISSION
    // ========================

    @PostMapping("/admission")
    public AdmissionDecision evaluateAdmission(@RequestBody @Valid AdmissionRequestDto request) {
        AdmissionRequest candidate = decisionDtoMapper.toDomain(request);
        AccountSnapshot account = toAccount(request.getAccount());
        MarketSnapshot market = marketSnapshotAssembler.assemble(request.getMarket());
        return request.isReserve()
                ? decisionEngine.admitAndReserve(candidate, account, market)
                : decisionEngine.evaluateAdmission(candidate, account, market);
    }

    @DeleteMapping("/reservations/{positionId}")
    public PositionResponse releaseReservation(@PathVariable String positionId) {
        return decisionDtoMapper.toResponse(decisionEngine.releaseReservation(positionId));
    }

    // ========================
    // SIZING
    // ========================

    @PostMapping("/sizing")
    public SizingResponse sizePosition(@RequestBody @Valid SizingRequest request) {
        SizingResult result = request.usesPriors()
                ? decisionEngine.sizePositionFromPriors(request.getStrategy())
                : decisionEngine.sizePosition(
                        request.getStrategy(),
                        valueOrNaN(request.getWinRate()),
                        valueOrNaN(request.getAverageWin()),
                        valueOrNaN(request.getAverageLoss()));

        SizingResponse response = decisionDtoMapper.toResponse(result);
        if (request.getEquity() != null && request.getMaxLossPerContract() != null) {
            response.setRecommendedContracts(kellyPositionSizer.recommendedContracts(
                    result, request.getEquity(), request.getMaxLossPerContract()));
        }
        return response;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @PostMapping("/lifecycle/{positionId}")
    public LifecycleDecision evaluateLifecycle(
            @PathVariable String positionId, @RequestBody @Valid LifecycleRequest request) {
        return decisionEngine.evaluatePositionLifecycle(
                positionId, marketSnapshotAssembler.assemble(request.getMarket()));
    }

    @PostMapping("/lifecycle/{positionId}/defense")
    public LifecycleDecision planDefense(
            @PathVariable String positionId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return decisionEngine.planDefense(positionId, date != null ? date : LocalDate.now(decisionClock));
    }

    @PostMapping("/tick")
    public TickReport onTick(@RequestBody @Valid TickRequest request) {
        return decisionEngine.onTick(toAccount(request.getAccount()), marketSnapshotAssembler.assemble(request.getMarket()));
    }

    @PostMapping("/fills")
    public PositionResponse registerFill(@RequestBody @Valid FillRequest request) {
        return decisionDtoMapper.toResponse(decisionEngine.registerFill(decisionDtoMapper.toDomain(request)));
    }

    // ========================
    // PROTOCOL / STATUS
    // ========================

    @GetMapping("/protocol")
    public ProtocolDirective currentProtocol(@RequestParam(required = false) VixRegime regime) {
        return regime != null ? decisionEngine.currentProtocol(regime) : decisionEngine.currentProtocol();
    }

    @GetMapping("/correlation/summary")
    public CorrelationSummary correlationSummary() {
        return correlationAdmissionController.summary();
    }

    @GetMapping("/phase")
    public PhaseMetrics phase(@RequestParam BigDecimal equity) {
        return phaseManager.phaseMetrics(equity);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("halted", decisionEngine.isHalted());
        status.put("haltReason", decisionEngine.getHaltReason().orElse(null));
        status.put("protocolLevel", decisionEngine.currentProtocol().getLevel());
        status.put("trackedPositions", correlationAdmissionController.totalTrackedPositions());
        return status;
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        log.info("Resume requested via API");
        decisionEngine.resume();
        return Map.of("halted", decisionEngine.isHalted());
    }

    private AccountSnapshot toAccount(AccountSnapshotDto dto) {
        AccountSnapshot account = decisionDtoMapper.toDomain(dto);
        account.setAsOf(Instant.now(decisionClock));
        return account;
    }

    private static double valueOrNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
