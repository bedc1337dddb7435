package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.component.feed.CelMode;
import com.infomedia.abacox.callshipping.component.shipping.ShippingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;

/**
 * Typed access to the engine configuration.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class EngineConfigService {

    private final ConfigService configService;

    // resolved once, lookups can block
    private volatile String localHostname;

    // --- Shipping ---

    public ShippingMode getShippingMode() {
        return ShippingMode.fromString(configService.getValue(ConfigKey.CALL_SHIPPING_MODE).asString());
    }

    public long getLongCallUpdateIntervalSeconds() {
        return Math.max(0, getLong(ConfigKey.LONG_CALL_UPDATE_INTERVAL));
    }

    public Duration getQuiescenceInterval() {
        return Duration.ofSeconds(Math.max(1, getLong(ConfigKey.QUIESCENCE_SECONDS)));
    }

    public boolean isCelCompletionRequired() {
        return configService.getValue(ConfigKey.REQUIRE_CEL_COMPLETION).asBoolean() && getCelMode() != CelMode.NONE;
    }

    public Duration getClosedGroupRetention() {
        return Duration.ofSeconds(Math.max(0, getLong(ConfigKey.CLOSED_GROUP_RETENTION_SECONDS)));
    }

    public boolean isCorrectiveReshipEnabled() {
        return configService.getValue(ConfigKey.CORRECTIVE_RESHIP_ENABLED).asBoolean();
    }

    public Duration getDedupRetention() {
        return Duration.ofHours(Math.max(1, getLong(ConfigKey.DEDUP_RETENTION_HOURS)));
    }

    public Duration getShipmentLogRetention() {
        return Duration.ofDays(Math.max(1, getLong(ConfigKey.SHIPMENT_LOG_RETENTION_DAYS)));
    }

    // --- Delivery ---

    public boolean isDeliveryEnabled() {
        return configService.getValue(ConfigKey.DELIVERY_ENABLED).asBoolean();
    }

    public int getBatchSize() {
        return Math.max(1, getInt(ConfigKey.BATCH_SIZE));
    }

    public Duration getBatchMaxWait() {
        return Duration.ofSeconds(Math.max(0, getLong(ConfigKey.BATCH_MAX_WAIT_SECONDS)));
    }

    public int getQueueCapacity() {
        return Math.max(1, getInt(ConfigKey.QUEUE_CAPACITY));
    }

    public Duration getRetryInitialBackoff() {
        return Duration.ofSeconds(Math.max(1, getLong(ConfigKey.RETRY_INITIAL_BACKOFF_SECONDS)));
    }

    public Duration getRetryMaxBackoff() {
        return Duration.ofSeconds(Math.max(1, getLong(ConfigKey.RETRY_MAX_BACKOFF_SECONDS)));
    }

    public Duration getRetryDeadline() {
        return Duration.ofHours(Math.max(1, getLong(ConfigKey.RETRY_DEADLINE_HOURS)));
    }

    public Duration getShutdownGrace() {
        return Duration.ofSeconds(Math.max(0, getLong(ConfigKey.SHUTDOWN_GRACE_SECONDS)));
    }

    // --- Remote API ---

    public String getApiUrl() {
        return configService.getValue(ConfigKey.API_URL).asString();
    }

    public String getApiKey() {
        return configService.getValue(ConfigKey.API_KEY).asString();
    }

    public Duration getApiTimeout() {
        return Duration.ofSeconds(Math.max(1, getLong(ConfigKey.API_TIMEOUT_SECONDS)));
    }

    public String getConnectorVersion() {
        return configService.getValue(ConfigKey.CONNECTOR_VERSION).asString();
    }

    public long getCustomerId() {
        return getLong(ConfigKey.CUSTOMER_ID);
    }

    public String getHostname() {
        String configured = configService.getValue(ConfigKey.HOSTNAME).asString();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String resolved = localHostname;
        if (resolved == null) {
            resolved = resolveLocalHostname();
            localHostname = resolved;
        }
        return resolved;
    }

    String resolveLocalHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local hostname", e);
            return "unknown";
        }
    }

    public boolean isIncludeRawData() {
        return configService.getValue(ConfigKey.INCLUDE_RAW_DATA).asBoolean();
    }

    // --- Classification ---

    public String getDefaultTenant() {
        String value = configService.getValue(ConfigKey.DEFAULT_TENANT).asString();
        return value == null ? "" : value.trim();
    }

    public List<String> getDidTenantMapEntries() {
        return configService.getValue(ConfigKey.DID_TENANT_MAP).asStringList();
    }

    public List<String> getAccountCodeTenantMapEntries() {
        return configService.getValue(ConfigKey.ACCOUNTCODE_TENANT_MAP).asStringList();
    }

    public List<String> getKnownTrunks() {
        return configService.getValue(ConfigKey.KNOWN_TRUNKS).asStringList();
    }

    public List<String> getInternalContexts() {
        return configService.getValue(ConfigKey.INTERNAL_CONTEXTS).asStringList();
    }

    public List<String> getExternalContexts() {
        return configService.getValue(ConfigKey.EXTERNAL_CONTEXTS).asStringList();
    }

    public List<String> getOutboundContexts() {
        return configService.getValue(ConfigKey.OUTBOUND_CONTEXTS).asStringList();
    }

    public List<String> getTrunkChannelPatterns() {
        return configService.getValue(ConfigKey.TRUNK_CHANNEL_PATTERNS).asStringList();
    }

    public List<String> getQueuePatterns() {
        return configService.getValue(ConfigKey.QUEUE_PATTERNS).asStringList();
    }

    public List<String> getIvrPatterns() {
        return configService.getValue(ConfigKey.IVR_PATTERNS).asStringList();
    }

    public List<String> getVoicemailPatterns() {
        return configService.getValue(ConfigKey.VOICEMAIL_PATTERNS).asStringList();
    }

    public List<String> getParkingPatterns() {
        return configService.getValue(ConfigKey.PARKING_PATTERNS).asStringList();
    }

    public List<String> getConferencePatterns() {
        return configService.getValue(ConfigKey.CONFERENCE_PATTERNS).asStringList();
    }

    public int getMinExtensionLength() {
        return Math.max(1, getInt(ConfigKey.MIN_EXTENSION_LENGTH));
    }

    public int getMaxExtensionLength() {
        return Math.max(getMinExtensionLength(), getInt(ConfigKey.MAX_EXTENSION_LENGTH));
    }

    public List<String> getInternationalPrefixes() {
        return configService.getValue(ConfigKey.INTERNATIONAL_PREFIXES).asStringList();
    }

    public Duration getTenantCacheTtl() {
        return Duration.ofSeconds(Math.max(0, getLong(ConfigKey.TENANT_CACHE_TTL_SECONDS)));
    }

    public int getTenantCacheMaxSize() {
        return Math.max(2, getInt(ConfigKey.TENANT_CACHE_MAX_SIZE));
    }

    // --- Feeds ---

    public boolean isFeedEnabled() {
        return configService.getValue(ConfigKey.FEED_ENABLED).asBoolean();
    }

    public String getCdrSourceUrl() {
        return configService.getValue(ConfigKey.CDR_SOURCE_URL).asString();
    }

    public String getCdrSourceUsername() {
        return configService.getValue(ConfigKey.CDR_SOURCE_USERNAME).asString();
    }

    public String getCdrSourcePassword() {
        return configService.getValue(ConfigKey.CDR_SOURCE_PASSWORD).asString();
    }

    public String getCdrTable() {
        return configService.getValue(ConfigKey.DB_TABLE_CDR).asString();
    }

    public CelMode getCelMode() {
        return CelMode.fromString(configService.getValue(ConfigKey.CEL_MODE).asString());
    }

    public String getCelTable() {
        return configService.getValue(ConfigKey.DB_TABLE_CEL).asString();
    }

    public String getCelCsvPath() {
        return configService.getValue(ConfigKey.CEL_CSV_PATH).asString();
    }

    public String getAmiHost() {
        return configService.getValue(ConfigKey.AMI_HOST).asString();
    }

    public int getAmiPort() {
        return getInt(ConfigKey.AMI_PORT);
    }

    public String getAmiUsername() {
        return configService.getValue(ConfigKey.AMI_USERNAME).asString();
    }

    public String getAmiPassword() {
        return configService.getValue(ConfigKey.AMI_PASSWORD).asString();
    }

    public int getAmiBufferSize() {
        return Math.max(100, getInt(ConfigKey.AMI_BUFFER_SIZE));
    }

    public int getPollBatchLimit() {
        return Math.max(1, getInt(ConfigKey.POLL_BATCH_LIMIT));
    }

    private int getInt(ConfigKey key) {
        try {
            return configService.getValue(key).asInt();
        } catch (IllegalArgumentException e) {
            log.warn("{}. Using default {}", e.getMessage(), key.getDefaultValue());
            return Integer.parseInt(key.getDefaultValue());
        }
    }

    private long getLong(ConfigKey key) {
        try {
            return configService.getValue(key).asLong();
        } catch (IllegalArgumentException e) {
            log.warn("{}. Using default {}", e.getMessage(), key.getDefaultValue());
            return Long.parseLong(key.getDefaultValue());
        }
    }
}
