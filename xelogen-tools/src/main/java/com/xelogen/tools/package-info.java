/**
 * Consumers of finished graphs that sit outside the builder: {@link com.xelogen.tools.GraphPrinter} for debug listings.
 */
package com.xelogen.tools;
