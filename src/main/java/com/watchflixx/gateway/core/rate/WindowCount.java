package com.watchflixx.gateway.core.rate;

import lombok.Value;

/**
 * 计数器自增后的值与所在窗口的结束时间
 */
@Value
public class WindowCount {
    long count;
    long resetTime;
}
