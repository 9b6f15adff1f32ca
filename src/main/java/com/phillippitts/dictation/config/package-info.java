/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.stt} - streaming session and local inference server properties</li>
 *   <li>{@code config.provision} - model cache, download policy and model catalog</li>
 *   <li>{@code config.logging} - MDC filter for the control API</li>
 * </ul>
 *
 * @see com.phillippitts.dictation.config.ThreadPoolConfig
 * @since 1.0
 */
package com.phillippitts.dictation.config;
