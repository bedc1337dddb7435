package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.infomedia.abacox.callshipping.component.classification.CallEndpoints;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;

public record TenantResolutionInput(CorrelatedGroup group, CallEndpoints endpoints) {
}
