package com.flagship.practice_analytics.scope;

import lombok.Value;

@Value
public class GroupInfo {
    String groupCode;
    String groupDesc;
    int clientCount;
}
