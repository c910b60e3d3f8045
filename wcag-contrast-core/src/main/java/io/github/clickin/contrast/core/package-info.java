/**
 * Color parsing, relative luminance and WCAG 2.1 contrast ratio.
 *
 * <p>This module has no third-party dependencies. It contains only:
 * <ul>
 *   <li>The {@link io.github.clickin.contrast.core.Color} value type and its hex parser</li>
 *   <li>The sRGB transfer curve and luminance weighting</li>
 *   <li>Contrast ratio and conformance levels</li>
 * </ul>
 *
 * <p>Every operation is pure and stateless. JSON bindings and the command-line runner live in
 * other modules.
 */
package io.github.clickin.contrast.core;
