package com.infomedia.abacox.callshipping.component.configmanager;

import lombok.Getter;

import java.util.List;
import java.util.stream.Stream;

/**
 * Enum representing all configurable keys of the engine.
 * Each key holds its default value to ensure the engine can always run.
 */
@Getter
public enum ConfigKey {

    // --- Shipping ---
    CALL_SHIPPING_MODE(ConfigGroup.SHIPPING, "complete"),
    LONG_CALL_UPDATE_INTERVAL(ConfigGroup.SHIPPING, "600"), // in seconds, 0 disables heartbeats
    QUIESCENCE_SECONDS(ConfigGroup.SHIPPING, "60"),
    REQUIRE_CEL_COMPLETION(ConfigGroup.SHIPPING, "true"),
    CLOSED_GROUP_RETENTION_SECONDS(ConfigGroup.SHIPPING, "300"),
    CORRECTIVE_RESHIP_ENABLED(ConfigGroup.SHIPPING, "true"),
    DEDUP_RETENTION_HOURS(ConfigGroup.SHIPPING, "24"),
    SHIPMENT_LOG_RETENTION_DAYS(ConfigGroup.SHIPPING, "7"),

    // --- Delivery ---
    DELIVERY_ENABLED(ConfigGroup.DELIVERY, "true"),
    BATCH_SIZE(ConfigGroup.DELIVERY, "100"),
    BATCH_MAX_WAIT_SECONDS(ConfigGroup.DELIVERY, "30"),
    QUEUE_CAPACITY(ConfigGroup.DELIVERY, "10000"),
    RETRY_INITIAL_BACKOFF_SECONDS(ConfigGroup.DELIVERY, "300"),
    RETRY_MAX_BACKOFF_SECONDS(ConfigGroup.DELIVERY, "3600"),
    RETRY_DEADLINE_HOURS(ConfigGroup.DELIVERY, "48"),
    SHUTDOWN_GRACE_SECONDS(ConfigGroup.DELIVERY, "10"),

    // --- Remote API ---
    API_URL(ConfigGroup.API, "https://api-us1.sipstack.com/v1/mqs/connectors/asterisk/calls"),
    API_KEY(ConfigGroup.API, ""),
    API_TIMEOUT_SECONDS(ConfigGroup.API, "30"),
    CONNECTOR_VERSION(ConfigGroup.API, "1.0.0"),
    CUSTOMER_ID(ConfigGroup.API, "0"),
    HOSTNAME(ConfigGroup.API, ""),
    INCLUDE_RAW_DATA(ConfigGroup.API, "false"),

    // --- Classification ---
    DEFAULT_TENANT(ConfigGroup.CLASSIFICATION, ""),
    DID_TENANT_MAP(ConfigGroup.CLASSIFICATION, ""), // did:tenant,did:tenant
    ACCOUNTCODE_TENANT_MAP(ConfigGroup.CLASSIFICATION, ""), // code:tenant,code:tenant
    KNOWN_TRUNKS(ConfigGroup.CLASSIFICATION, ""),
    INTERNAL_CONTEXTS(ConfigGroup.CLASSIFICATION,
            "from-internal,from-internal-xfer,from-inside*,ext-local,macro-dial,macro-dial-one,ext-group,ext-queues,app-*,ivr-*,from-queue,default"),
    EXTERNAL_CONTEXTS(ConfigGroup.CLASSIFICATION,
            "from-trunk,from-trunk-*,from-pstn,from-pstn-*,from-did,from-did-direct,from-external,from-sip-external,from-dahdi,incoming,inbound*"),
    OUTBOUND_CONTEXTS(ConfigGroup.CLASSIFICATION, "outrt-*,outbound-allroutes,macro-dialout*,from-internal-outbound*"),
    TRUNK_CHANNEL_PATTERNS(ConfigGroup.CLASSIFICATION, "sip/sbc-*,sip/sbc_*,pjsip/sbc-*,pjsip/sbc_*,dahdi/*,iax2/*,sip/trunk*,pjsip/trunk*"),
    QUEUE_PATTERNS(ConfigGroup.CLASSIFICATION, "ext-queues,from-queue,queue*"),
    IVR_PATTERNS(ConfigGroup.CLASSIFICATION, "ivr-*,app-ivr*"),
    VOICEMAIL_PATTERNS(ConfigGroup.CLASSIFICATION, "app-vmmain,vm-*,macro-vm,voicemail*"),
    PARKING_PATTERNS(ConfigGroup.CLASSIFICATION, "park-*,parkedcalls,app-parking*"),
    CONFERENCE_PATTERNS(ConfigGroup.CLASSIFICATION, "ext-meetme,conference*,app-conference*"),
    MIN_EXTENSION_LENGTH(ConfigGroup.CLASSIFICATION, "2"),
    MAX_EXTENSION_LENGTH(ConfigGroup.CLASSIFICATION, "7"),
    INTERNATIONAL_PREFIXES(ConfigGroup.CLASSIFICATION, "011,00,+"),
    TENANT_CACHE_TTL_SECONDS(ConfigGroup.CLASSIFICATION, "3600"),
    TENANT_CACHE_MAX_SIZE(ConfigGroup.CLASSIFICATION, "10000"),

    // --- Feeds ---
    FEED_ENABLED(ConfigGroup.FEED, "true"),
    CDR_SOURCE_URL(ConfigGroup.FEED, "jdbc:mysql://localhost:3306/asteriskcdrdb"),
    CDR_SOURCE_USERNAME(ConfigGroup.FEED, "asterisk"),
    CDR_SOURCE_PASSWORD(ConfigGroup.FEED, ""),
    DB_TABLE_CDR(ConfigGroup.FEED, "cdr"),
    CEL_MODE(ConfigGroup.FEED, "db"), // db, csv, ami or none
    DB_TABLE_CEL(ConfigGroup.FEED, "cel"),
    CEL_CSV_PATH(ConfigGroup.FEED, "/var/log/asterisk/cel-custom/Master.csv"),
    AMI_HOST(ConfigGroup.FEED, "localhost"),
    AMI_PORT(ConfigGroup.FEED, "5038"),
    AMI_USERNAME(ConfigGroup.FEED, ""),
    AMI_PASSWORD(ConfigGroup.FEED, ""),
    AMI_BUFFER_SIZE(ConfigGroup.FEED, "50000"),
    POLL_BATCH_LIMIT(ConfigGroup.FEED, "1000");

    private final ConfigGroup group;
    private final String defaultValue;

    ConfigKey(ConfigGroup group, String defaultValue) {
        this.group = group;
        this.defaultValue = defaultValue;
    }

    public static List<ConfigKey> getKeys(ConfigGroup group) {
        return Stream.of(values())
                .filter(key -> key.getGroup() == group)
                .toList();
    }

    /**
     * Converts the enum's name from UPPER_SNAKE_CASE to lowerCamelCase.
     * For example, LONG_CALL_UPDATE_INTERVAL becomes longCallUpdateInterval.
     */
    public String getKey() {
        String[] parts = this.name().toLowerCase().split("_");
        if (parts.length == 1) {
            return parts[0];
        }
        StringBuilder camelCaseString = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            camelCaseString.append(Character.toUpperCase(part.charAt(0)))
                    .append(part.substring(1));
        }
        return camelCaseString.toString();
    }

    /**
     * Property name used to override the default from application.yml or the environment,
     * e.g. {@code callshipping.shipping.longCallUpdateInterval}.
     */
    public String getPropertyName() {
        return "callshipping." + group.name().toLowerCase() + "." + getKey();
    }
}
