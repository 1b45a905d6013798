package org.waabox.budman.spring;

import org.waabox.budman.Budman;

/**
 * A callback interface for adjusting the {@link Budman.Builder} during
 * Spring Boot auto-configuration, after the properties have been applied.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * @Bean
 * BudmanCustomizer strictBudman() {
 *     return builder -> builder.raiseOnErrors(true);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface BudmanCustomizer {

  /**
   * Adjusts the builder.
   *
   * @param builder the builder, never null
   */
  void customize(Budman.Builder builder);
}
