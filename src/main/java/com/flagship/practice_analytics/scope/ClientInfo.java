package com.flagship.practice_analytics.scope;

import lombok.Value;

import java.util.UUID;

@Value
public class ClientInfo {
    UUID clientId;
    String clientCode;
    String clientName;
    String groupCode;
}
