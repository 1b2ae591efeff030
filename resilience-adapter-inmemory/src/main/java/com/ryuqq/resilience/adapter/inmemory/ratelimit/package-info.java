/**
 * In-Memory 슬라이딩 윈도우 Rate Limiter Adapter.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.ratelimit;
