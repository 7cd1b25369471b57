/**
 * Shared utilities for all fixie-data modules.
 *
 * <p>Contains {@link org.ergs.fixie.util.Holding} (retention normalization),
 * {@link org.ergs.fixie.util.GlobPattern} (shell-glob matching of path keys) and
 * {@link org.ergs.fixie.util.AtomicFiles} (write-then-install file replacement).
 * No framework dependencies: pure Java.
 */
package org.ergs.fixie.util;
