package com.infomedia.abacox.callshipping.component.configmanager;

public enum ConfigGroup {
    SHIPPING,
    DELIVERY,
    API,
    CLASSIFICATION,
    FEED
}
