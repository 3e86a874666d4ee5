package com.flagship.practice_analytics.scope;

import lombok.Value;

import java.util.UUID;

@Value
public class TaskInfo {
    UUID taskId;
    String taskCode;
    String taskDesc;
    UUID clientId;
}
