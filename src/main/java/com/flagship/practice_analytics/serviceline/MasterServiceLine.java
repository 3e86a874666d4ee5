package com.flagship.practice_analytics.serviceline;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MasterServiceLine {
    String code;
    String name;
}
