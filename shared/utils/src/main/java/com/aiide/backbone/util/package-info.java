/**
 * Framework-free helpers shared by all Backbone modules.
 *
 * <p>Nothing in here depends on CDI or Quarkus, so the core primitives can be
 * unit tested with a plain JUnit runner.
 */
package com.aiide.backbone.util;
