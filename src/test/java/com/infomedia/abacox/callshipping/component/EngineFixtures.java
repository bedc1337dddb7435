package com.infomedia.abacox.callshipping.component;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregateBuilder;
import com.infomedia.abacox.callshipping.component.classification.CallDirectionService;
import com.infomedia.abacox.callshipping.component.classification.CallFeatureDetector;
import com.infomedia.abacox.callshipping.component.classification.NumberAnalyzer;
import com.infomedia.abacox.callshipping.component.classification.NumberExtractionService;
import com.infomedia.abacox.callshipping.component.classification.PatternMatcher;
import com.infomedia.abacox.callshipping.component.classification.tenant.AccountCodeTenantStrategy;
import com.infomedia.abacox.callshipping.component.classification.tenant.CdrFieldScanTenantStrategy;
import com.infomedia.abacox.callshipping.component.classification.tenant.CelFieldScanTenantStrategy;
import com.infomedia.abacox.callshipping.component.classification.tenant.DefaultTenantStrategy;
import com.infomedia.abacox.callshipping.component.classification.tenant.DidTenantStrategy;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantCache;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantResolutionService;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantTokenScanner;
import com.infomedia.abacox.callshipping.component.classification.tenant.TenantValidator;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigValueService;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import com.infomedia.abacox.callshipping.component.normalizer.CdrRecord;
import com.infomedia.abacox.callshipping.component.normalizer.CelEventType;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import com.infomedia.abacox.callshipping.component.normalizer.Disposition;
import com.infomedia.abacox.callshipping.db.repository.ConfigValueRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.mock.env.MockEnvironment;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;

/**
 * Builds engine components without a Spring context. Configuration comes from a mock environment
 * over an empty override table.
 */
public final class EngineFixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private EngineFixtures() {
    }

    public static ConfigService configService(Map<ConfigKey, String> values) {
        MockEnvironment environment = new MockEnvironment();
        values.forEach((key, value) -> environment.setProperty(key.getPropertyName(), value));
        ConfigValueRepository repository = mock(ConfigValueRepository.class);
        return new ConfigService(new ConfigValueService(repository, environment));
    }

    public static EngineConfigService config(Map<ConfigKey, String> values) {
        return new EngineConfigService(configService(values));
    }

    public static EngineConfigService config() {
        return config(Map.of());
    }

    public static EngineMetrics metrics() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    /**
     * Classifiers and aggregate builder wired the way the application context wires them.
     */
    public static class Classifiers {
        public final EngineConfigService config;
        public final PatternMatcher patternMatcher = new PatternMatcher();
        public final NumberAnalyzer numberAnalyzer;
        public final CallDirectionService directionService;
        public final NumberExtractionService numberExtractionService;
        public final CallFeatureDetector featureDetector;
        public final TenantValidator tenantValidator;
        public final TenantTokenScanner tokenScanner;
        public final TenantCache tenantCache;
        public final TenantResolutionService tenantResolution;
        public final CallAggregateBuilder aggregateBuilder;

        public Classifiers(Map<ConfigKey, String> values, Clock clock) {
            ConfigService configService = configService(values);
            this.config = new EngineConfigService(configService);
            this.numberAnalyzer = new NumberAnalyzer(config);
            this.directionService = new CallDirectionService(config, patternMatcher, numberAnalyzer);
            this.numberExtractionService = new NumberExtractionService(numberAnalyzer);
            this.featureDetector = new CallFeatureDetector(config, patternMatcher, numberAnalyzer);
            this.tenantValidator = new TenantValidator(config);
            this.tokenScanner = new TenantTokenScanner(tenantValidator);
            this.tenantCache = new TenantCache(config, configService, clock);
            this.tenantResolution = new TenantResolutionService(List.of(
                    new DidTenantStrategy(config, tenantValidator),
                    new AccountCodeTenantStrategy(config, tenantValidator),
                    new CdrFieldScanTenantStrategy(tokenScanner),
                    new CelFieldScanTenantStrategy(tokenScanner, tenantValidator),
                    new DefaultTenantStrategy(config)), tenantCache, metrics());
            this.aggregateBuilder = new CallAggregateBuilder(directionService, featureDetector,
                    numberExtractionService, tenantResolution, numberAnalyzer, config);
        }

        public Classifiers(Map<ConfigKey, String> values) {
            this(values, Clock.fixed(T0, ZoneOffset.UTC));
        }
    }

    public static CdrRecord.CdrRecordBuilder cdr(String linkedId) {
        return CdrRecord.builder()
                .uniqueId(linkedId)
                .linkedId(linkedId)
                .startTime(T0)
                .src("")
                .dst("")
                .callerIdName("")
                .context("")
                .dcontext("")
                .channel("")
                .dstChannel("")
                .lastApp("")
                .lastData("")
                .disposition(Disposition.ANSWERED)
                .accountCode("")
                .userField("")
                .peerAccount("");
    }

    public static CelRecord.CelRecordBuilder cel(String linkedId, CelEventType type, Instant at) {
        return CelRecord.builder()
                .eventType(type)
                .eventName(type.name())
                .eventTime(at)
                .linkedId(linkedId)
                .uniqueId(linkedId)
                .cidName("")
                .cidNum("")
                .exten("")
                .context("")
                .chanName("")
                .appName("")
                .appData("")
                .accountCode("")
                .peer("")
                .extra("");
    }

    /**
     * A clock tests can move forward.
     */
    public static class MutableClock extends Clock {
        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        public void set(Instant instant) {
            now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
