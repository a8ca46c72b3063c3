/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.kvspace.plugin;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * Detects risky plugin setups and warns about each condition at most once.
 *
 * <p>Conditions:
 *
 * <ul>
 *   <li>lenient error policy while a plugin declares a security-sensitive {@link PluginTrait}
 *       (a failing encryption or quota hook would be skipped silently);
 *   <li>an {@link PluginTrait#ENCRYPTS encrypting} plugin running before a {@link
 *       PluginTrait#COMPRESSES compressing} one (ciphertext does not compress).
 * </ul>
 */
@Slf4j
final class PluginConfigurationValidator {

  static final String LENIENT_SECURITY = "lenient-security";
  static final String ENCRYPT_BEFORE_COMPRESS = "encrypt-before-compress";

  private final Set<String> reported = new HashSet<>();
  private final List<String> warnings = new ArrayList<>();

  /**
   * Checks the registrations in execution order.
   *
   * @return warnings emitted by this call
   */
  synchronized List<String> validate(
      final List<PluginRegistration> ordered, final PluginErrorPolicy policy) {
    final var emitted = new ArrayList<String>();

    if (policy == PluginErrorPolicy.LENIENT && !reported.contains(LENIENT_SECURITY)) {
      final var sensitive =
          ordered.stream()
              .filter(PluginConfigurationValidator::isSecuritySensitive)
              .map(PluginRegistration::getName)
              .collect(Collectors.toList());
      if (!sensitive.isEmpty()) {
        emit(
            LENIENT_SECURITY,
            "Plugins "
                + sensitive
                + " are security-sensitive but pluginErrorPolicy is LENIENT; their failures will"
                + " be logged and skipped",
            emitted);
      }
    }

    if (!reported.contains(ENCRYPT_BEFORE_COMPRESS)) {
      String encryptor = null;
      for (final var registration : ordered) {
        final var traits = registration.getPlugin().getTraits();
        if (encryptor == null && traits.contains(PluginTrait.ENCRYPTS)) {
          encryptor = registration.getName();
        } else if (encryptor != null && traits.contains(PluginTrait.COMPRESSES)) {
          emit(
              ENCRYPT_BEFORE_COMPRESS,
              "Plugin '"
                  + encryptor
                  + "' encrypts before '"
                  + registration.getName()
                  + "' compresses; give the compressing plugin a higher priority",
              emitted);
          break;
        }
      }
    }
    return emitted;
  }

  /** Every warning emitted so far. */
  synchronized List<String> getWarnings() {
    return List.copyOf(warnings);
  }

  private static boolean isSecuritySensitive(final PluginRegistration registration) {
    return registration.getPlugin().getTraits().stream().anyMatch(PluginTrait::isSecuritySensitive);
  }

  private void emit(final String condition, final String message, final List<String> emitted) {
    reported.add(condition);
    warnings.add(message);
    emitted.add(message);
    log.warn(message);
  }
}
