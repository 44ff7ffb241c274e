/**
 * Node schema catalog.
 * <ul>
 *   <li>{@link com.xelogen.catalog.NodeCatalog} – registry loaded from the bundled {@code xelogen/node-catalog.json} or XELOGEN_CATALOG_FILE</li>
 *   <li>{@link com.xelogen.catalog.CatalogDocument} / {@link com.xelogen.catalog.NodeSpecEntry} – JSON DTOs</li>
 * </ul>
 */
package com.xelogen.catalog;
