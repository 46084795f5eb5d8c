// file: src/main/java/io/pagelite/server/dto/PageItem.java
package io.pagelite.server.dto;

/**
 * One page in GET /config/list, and the JSON body for POST /config/save.
 * Example:
 *   {
 *     "name": "index",
 *     "config": "{\"type\":\"page\",\"body\":[]}"
 *   }
 * 'config' carries the page document as JSON text.
 */
public class PageItem {
    public String name;
    public String config;

    public PageItem() {
    }

    public PageItem(String name, String config) {
        this.name = name;
        this.config = config;
    }
}
