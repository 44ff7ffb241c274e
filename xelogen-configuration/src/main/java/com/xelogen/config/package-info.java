/**
 * Environment-driven settings shared by the catalog loader and the lint engine.
 */
package com.xelogen.config;
