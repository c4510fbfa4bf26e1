/**
 * Daemon server: socket path handling, the line pipeline and the
 * listen / shutdown lifecycle.
 */
package com.questrail.helixd.server;
