package com.signalrelay.loadbalancer.routing;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import lombok.Builder;
import lombok.Value;
import reactor.netty.http.server.HttpServerRequest;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * Request attributes a routing decision may look at.
 */
@Value
@Builder
public class RoutingContext {

    public static final String ROOM_PARAM = "room";

    String remoteAddress;
    String sessionId;   // sticky session token, null when absent
    String roomHint;    // room the client is about to join, null when unknown

    public static RoutingContext from(HttpServerRequest request, String stickyCookie) {
        return from(request.requestHeaders(), request.uri(), request.remoteAddress(), stickyCookie);
    }

    public static RoutingContext from(HttpHeaders headers, String uri, InetSocketAddress remote, String stickyCookie) {
        return RoutingContext.builder()
            .remoteAddress(remote == null ? null : hostOf(remote))
            .sessionId(cookieValue(headers.get(HttpHeaderNames.COOKIE), stickyCookie))
            .roomHint(queryParam(uri, ROOM_PARAM))
            .build();
    }

    static String hostOf(InetSocketAddress address) {
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }

    private static String cookieValue(String header, String name) {
        if (header == null || header.isEmpty()) {
            return null;
        }
        // LAX tolerates the loosely formatted cookies browsers send
        for (Cookie cookie : ServerCookieDecoder.LAX.decode(header)) {
            if (cookie.name().equals(name) && !cookie.value().isEmpty()) {
                return cookie.value();
            }
        }
        return null;
    }

    private static String queryParam(String uri, String name) {
        if (uri == null) {
            return null;
        }
        List<String> values = new QueryStringDecoder(uri).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return null;
        }
        return values.get(0);
    }
}
