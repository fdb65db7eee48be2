package com.example.workflowdispatch.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys for dispatch-scoped logging.
 */
public final class MdcContext {

    public static final String DISPATCH_ID = "dispatchId";
    public static final String NODE_ID = "nodeId";

    private MdcContext() {}

    public static void setDispatch(UUID dispatchId) {
        MDC.put(DISPATCH_ID, String.valueOf(dispatchId));
    }

    public static void setNode(UUID dispatchId, int nodeId) {
        MDC.put(DISPATCH_ID, String.valueOf(dispatchId));
        MDC.put(NODE_ID, String.valueOf(nodeId));
    }

    public static void clear() {
        MDC.remove(DISPATCH_ID);
        MDC.remove(NODE_ID);
    }
}
