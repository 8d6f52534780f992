package com.cloudcost.analytics.api;

import com.cloudcost.analytics.alerting.AlertConfig;
import com.cloudcost.analytics.alerting.AlertSettingsService;
import com.cloudcost.analytics.anomaly.AnomalyDetectionRequest;
import com.cloudcost.analytics.anomaly.Sensitivity;
import com.cloudcost.analytics.domain.model.Alert;
import com.cloudcost.analytics.domain.model.Anomaly;
import com.cloudcost.analytics.domain.model.AnomalySeverity;
import com.cloudcost.analytics.domain.model.CloudProvider;
import com.cloudcost.analytics.domain.model.NotificationChannel;
import com.cloudcost.analytics.error.ValidationException;
import com.cloudcost.analytics.forecast.CostForecastReport;
import com.cloudcost.analytics.forecast.CostForecastService;
import com.cloudcost.analytics.forecast.SimulationInput;
import com.cloudcost.analytics.pipeline.CostAnalyticsPipeline;
import com.cloudcost.analytics.pipeline.PipelineRunSummary;
import com.cloudcost.analytics.store.AlertStore;
import com.cloudcost.analytics.store.AnomalyStore;
import com.cloudcost.analytics.store.DimensionFilter;
import com.cloudcost.analytics.store.TimeWindow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read and trigger endpoints backing the cost dashboard.
 *
 * The caller identity arrives in the {@code X-User-Id} header, set by the gateway in
 * front of this service.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cost Analytics", description = "Anomalies, forecasts and alerts")
public class CostAnalyticsController {

    static final String USER_HEADER = "X-User-Id";
    private static final String ALL = "all";

    private final CostAnalyticsPipeline pipeline;
    private final CostForecastService forecastService;
    private final AnomalyStore anomalyStore;
    private final AlertStore alertStore;
    private final AlertSettingsService alertSettingsService;
    private final Clock clock;

    @Value("${analytics.detection.default-sensitivity:medium}")
    private String defaultSensitivity = "medium";

    @GetMapping("/anomalies")
    @Operation(summary = "List anomalies",
               description = "Anomalies in the time range, newest first. Filters accept 'all'.")
    public ResponseEntity<List<Anomaly>> listAnomalies(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) String provider,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "30d") String timeRange
    ) {
        DimensionFilter filter = new DimensionFilter(parseProvider(provider), orNull(service), null);
        AnomalySeverity severityFilter = orNull(severity) == null
                ? null
                : parseEnum(AnomalySeverity.class, severity, "severity");

        return ResponseEntity.ok(anomalyStore.findAnomalies(
                userId, filter, severityFilter, TimeWindow.fromRange(timeRange, clock)));
    }

    @PostMapping("/anomalies/detect")
    @Operation(summary = "Run anomaly detection",
               description = "Detects anomalies in the lookback window and dispatches resulting alerts")
    public ResponseEntity<PipelineRunSummary> detectAnomalies(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody(required = false) DetectAnomaliesRequest request
    ) {
        DetectAnomaliesRequest body = request != null
                ? request
                : new DetectAnomaliesRequest(null, null, null, null, null);
        log.info("Detection requested by user {}", userId);

        String sensitivity = body.sensitivity() == null || body.sensitivity().isBlank()
                ? defaultSensitivity
                : body.sensitivity();
        AnomalyDetectionRequest detection = new AnomalyDetectionRequest(
                userId,
                new DimensionFilter(parseProvider(body.provider()), orNull(body.service()), orNull(body.project())),
                Sensitivity.fromCode(sensitivity),
                body.threshold()
        );
        return ResponseEntity.ok(pipeline.run(detection));
    }

    @PostMapping("/forecasts")
    @Operation(summary = "Forecast cost",
               description = "30-day forecast of total and per-dimension cost with optional what-if inputs")
    public ResponseEntity<CostForecastReport> forecast(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ForecastRequest request
    ) {
        ForecastRequest.SimulationRequest sim = request.simulationInput();
        SimulationInput simulation = sim == null
                ? SimulationInput.none()
                : new SimulationInput(sim.newDeployments(), sim.expectedGrowth(), sim.plannedChanges());

        DimensionFilter filter = new DimensionFilter(
                parseProvider(request.provider()), orNull(request.service()), orNull(request.project()));

        return ResponseEntity.ok(forecastService.forecast(userId, filter, request.timeframe(), simulation));
    }

    @GetMapping("/alerts")
    @Operation(summary = "List alerts", description = "Alerts created in the time range, newest first")
    public ResponseEntity<List<Alert>> listAlerts(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(defaultValue = "30d") String timeRange
    ) {
        return ResponseEntity.ok(alertStore.findAlerts(userId, TimeWindow.fromRange(timeRange, clock)));
    }

    @GetMapping("/alert-settings")
    @Operation(summary = "Get alert settings", description = "Returns defaults when the user has none")
    public ResponseEntity<AlertSettingsRequest> getAlertSettings(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(toDto(alertSettingsService.getAlertConfig(userId)));
    }

    @PutMapping("/alert-settings")
    @Operation(summary = "Update alert settings")
    public ResponseEntity<AlertSettingsRequest> updateAlertSettings(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody AlertSettingsRequest request
    ) {
        AlertConfig saved = alertSettingsService.saveAlertConfig(userId, toConfig(userId, request));
        return ResponseEntity.ok(toDto(saved));
    }

    private AlertConfig toConfig(String userId, AlertSettingsRequest request) {
        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        if (request.channels().email()) channels.add(NotificationChannel.EMAIL);
        if (request.channels().chat()) channels.add(NotificationChannel.CHAT);
        if (request.channels().inApp()) channels.add(NotificationChannel.IN_APP);

        Map<AnomalySeverity, Double> thresholds = new EnumMap<>(AnomalySeverity.class);
        thresholds.put(AnomalySeverity.CRITICAL, request.thresholds().critical());
        thresholds.put(AnomalySeverity.HIGH, request.thresholds().high());
        thresholds.put(AnomalySeverity.MEDIUM, request.thresholds().medium());
        thresholds.put(AnomalySeverity.LOW, request.thresholds().low());

        Map<AnomalySeverity, Boolean> notify = new EnumMap<>(AnomalySeverity.class);
        notify.put(AnomalySeverity.CRITICAL, request.preferences().notifyOnCritical());
        notify.put(AnomalySeverity.HIGH, request.preferences().notifyOnHigh());
        notify.put(AnomalySeverity.MEDIUM, request.preferences().notifyOnMedium());
        notify.put(AnomalySeverity.LOW, request.preferences().notifyOnLow());

        return new AlertConfig(userId, channels, thresholds, notify,
                orNull(request.emailAddress()), orNull(request.chatChannel()));
    }

    private AlertSettingsRequest toDto(AlertConfig config) {
        return new AlertSettingsRequest(
                new AlertSettingsRequest.Channels(
                        config.isEnabled(NotificationChannel.EMAIL),
                        config.isEnabled(NotificationChannel.CHAT),
                        config.isEnabled(NotificationChannel.IN_APP)),
                new AlertSettingsRequest.Thresholds(
                        config.threshold(AnomalySeverity.CRITICAL),
                        config.threshold(AnomalySeverity.HIGH),
                        config.threshold(AnomalySeverity.MEDIUM),
                        config.threshold(AnomalySeverity.LOW)),
                new AlertSettingsRequest.Preferences(
                        config.shouldNotify(AnomalySeverity.CRITICAL),
                        config.shouldNotify(AnomalySeverity.HIGH),
                        config.shouldNotify(AnomalySeverity.MEDIUM),
                        config.shouldNotify(AnomalySeverity.LOW)),
                config.emailAddress(),
                config.chatChannel()
        );
    }

    private static CloudProvider parseProvider(String provider) {
        String value = orNull(provider);
        if (value == null) {
            return null;
        }
        try {
            return CloudProvider.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + field + ": " + value);
        }
    }

    /**
     * Blank and "all" mean no filter.
     */
    private static String orNull(String value) {
        return value == null || value.isBlank() || ALL.equalsIgnoreCase(value) ? null : value;
    }
}
