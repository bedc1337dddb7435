package com.infomedia.abacox.callshipping.component.feed;

/**
 * A CEL transport, selected by the configured CEL mode.
 */
public interface CelFeedAdapter extends FeedAdapter {

    CelMode celMode();
}
