package cn.gm.light.pinot.core.transport;

import cn.gm.light.pinot.core.codec.BrokerResponseDecoder;
import cn.gm.light.pinot.core.codec.JsonCodec;
import cn.gm.light.pinot.entity.BrokerResponse;
import cn.gm.light.pinot.entity.Request;
import cn.gm.light.pinot.enums.QueryFormat;
import cn.gm.light.pinot.exception.ProtocolException;
import cn.gm.light.pinot.exception.TransportException;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON over HTTP 查询，POST 到 broker 的 /query/sql（SQL）或 /query（PQL）。
 *
 * @author 明溪
 * @version 1.0
 * @project pinot-client
 * @date 2025/6/3 16:20:44
 */
@Slf4j
public class JsonHttpClientTransport implements ClientTransport {
    public static final String CONTENT_TYPE = "application/json; charset=utf-8";
    private static final MediaType JSON_MEDIA_TYPE = MediaType.get(CONTENT_TYPE);

    private final OkHttpClient client;
    private final Map<String, String> header;

    public JsonHttpClientTransport(OkHttpClient client, Map<String, String> header) {
        this.client = client;
        this.header = header == null ? Collections.emptyMap() : new LinkedHashMap<>(header);
    }

    @Override
    public BrokerResponse execute(String brokerAddress, Request request) {
        String url = getQueryUrl(request.getQueryFormat(), brokerAddress);
        Map<String, String> requestJson = new LinkedHashMap<>();
        requestJson.put(request.getQueryFormat().getKey(), request.getQuery());
        String queryOptions = QueryOptions.build(request, client.callTimeoutMillis());
        if (!queryOptions.isEmpty()) {
            requestJson.put("queryOptions", queryOptions);
        }
        if (request.isTrace()) {
            requestJson.put("trace", "true");
        }
        okhttp3.Request.Builder builder = new okhttp3.Request.Builder()
                .url(url)
                .post(RequestBody.create(JsonCodec.toJson(requestJson), JSON_MEDIA_TYPE))
                .header("Content-Type", CONTENT_TYPE);
        header.forEach(builder::header);
        log.debug("Sending query to {}: {}", url, request.getQuery());

        try (Response resp = client.newCall(builder.build()).execute()) {
            if (resp.code() != 200) {
                throw TransportException.of("caught http exception when querying Pinot: " + statusLine(resp));
            }
            ResponseBody body = resp.body();
            byte[] bytes = body == null ? new byte[0] : body.bytes();
            try {
                return BrokerResponseDecoder.decode(bytes);
            } catch (JSONException e) {
                throw new ProtocolException("unable to unmarshal json response to a brokerResponse structure: "
                        + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new TransportException("got exceptions during sending request: " + e.getMessage(), e);
        }
    }

    static String getQueryUrl(QueryFormat queryFormat, String brokerAddress) {
        String base = brokerAddress.startsWith("http://") || brokerAddress.startsWith("https://")
                ? brokerAddress
                : "http://" + brokerAddress;
        return queryFormat == QueryFormat.SQL ? base + "/query/sql" : base + "/query";
    }

    private static String statusLine(Response resp) {
        return resp.message() == null || resp.message().isEmpty()
                ? String.valueOf(resp.code())
                : resp.code() + " " + resp.message();
    }
}
