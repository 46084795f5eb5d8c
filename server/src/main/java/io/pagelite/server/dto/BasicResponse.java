// file: src/main/java/io/pagelite/server/dto/BasicResponse.java
package io.pagelite.server.dto;

import java.util.Map;

/**
 * JSON envelope for every non-document response.
 * Example (success):
 *   {
 *     "status": 0,
 *     "msg": "save page config successfully",
 *     "data": null
 *   }
 * Example (failure):
 *   {
 *     "status": -1,
 *     "msg": "name is empty",
 *     "data": null
 *   }
 */
public class BasicResponse {
    public int status;
    public String msg = "";
    public Map<String, Object> data;

    public static BasicResponse ok(String msg) {
        var r = new BasicResponse();
        r.msg = msg;
        return r;
    }

    public static BasicResponse ok(Map<String, Object> data) {
        var r = new BasicResponse();
        r.data = data;
        return r;
    }

    public static BasicResponse fail(String msg) {
        var r = new BasicResponse();
        r.status = -1;
        r.msg = msg;
        return r;
    }
}
