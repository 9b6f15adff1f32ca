/**
 * Domain models shared by the streaming, local inference and provisioning components.
 *
 * <p>All domain models are immutable records or enums and validate themselves on construction.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.dictation.domain.ConnectionState} - streaming session lifecycle</li>
 *   <li>{@link com.phillippitts.dictation.domain.ServerProcessState} - local process lifecycle and
 *       its allowed transitions</li>
 *   <li>{@link com.phillippitts.dictation.domain.Credential} - bearer token with age-based validity</li>
 *   <li>{@link com.phillippitts.dictation.domain.TranscriptionResult} - text plus timing metadata</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.dictation.domain;
