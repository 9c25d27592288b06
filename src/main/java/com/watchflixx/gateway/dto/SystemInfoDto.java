package com.watchflixx.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "网关进程信息")
public class SystemInfoDto {

    @Schema(description = "启动时间（ISO-8601）")
    private String startTime;

    @Schema(description = "运行时长（秒）")
    private Long uptimeSeconds;

    @Schema(description = "Java 版本")
    private String javaVersion;

    @Schema(description = "可用处理器数")
    private Integer availableProcessors;

    @Schema(description = "已用堆内存（字节）")
    private Long heapUsed;

    @Schema(description = "最大堆内存（字节），未限制时为 -1")
    private Long heapMax;

    @Schema(description = "活动线程数")
    private Integer threadCount;

    @Schema(description = "当前飞行中的代理请求数")
    private Integer inflightRequests;

    @Schema(description = "飞行中请求数峰值")
    private Long peakInflightRequests;

    @Schema(description = "指标缓冲区中的记录数")
    private Integer bufferedMetrics;
}
