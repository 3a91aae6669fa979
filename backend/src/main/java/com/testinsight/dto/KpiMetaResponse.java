package com.testinsight.dto;

import com.testinsight.model.enums.KpiType;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KpiMetaResponse {

    private String id;
    private String category;
    private String name;
    private String description;

    public static KpiMetaResponse from(KpiType kpi) {
        return KpiMetaResponse.builder()
                .id(kpi.getId())
                .category(kpi.getCategory().name().toLowerCase())
                .name(kpi.getDisplayName())
                .description(kpi.getDescription())
                .build();
    }
}
