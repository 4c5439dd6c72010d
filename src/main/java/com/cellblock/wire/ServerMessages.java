package com.cellblock.wire;

/**
 * Frame types spoken between a coordinator and a per-connection runtime server.
 */
public final class ServerMessages {

    private ServerMessages() {}

    // requests, each answered with a reply frame
    public static final String ATTACH = "attach";
    public static final String EVALUATE = "evaluate";
    public static final String FORGET = "forget";
    public static final String DROP_CONTAINER = "drop_container";
    public static final String READ_FILE = "read_file";
    public static final String INTELLISENSE = "intellisense";
    public static final String STOP = "stop";

    // events pushed to the owner
    public static final String EVALUATION_RESPONSE = "evaluation_response";
    public static final String CONTAINER_DOWN = "container_down";
    public static final String SERVER_STOPPED = "server_stopped";
}
