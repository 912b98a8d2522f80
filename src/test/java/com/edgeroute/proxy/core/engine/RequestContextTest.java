package com.edgeroute.proxy.core.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTest {

    @Test
    void canonicalHost_lowercasesAndDropsPort() {
        assertThat(RequestContext.canonicalHost("App.Example.COM:8443")).isEqualTo("app.example.com");
        assertThat(RequestContext.canonicalHost("example.com.")).isEqualTo("example.com");
        assertThat(RequestContext.canonicalHost("[::1]:8080")).isEqualTo("[::1]");
        assertThat(RequestContext.canonicalHost(null)).isEmpty();
    }

    @Test
    void path_dropsQueryAndDefaultsToRoot() {
        assertThat(new RequestContext("h", "/a/b?x=1", null, 0).getPath()).isEqualTo("/a/b");
        assertThat(new RequestContext("h", null, null, 0).getPath()).isEqualTo("/");
        assertThat(new RequestContext("h", "?q", null, 0).getPath()).isEqualTo("/");
    }

    @Test
    void setPath_keepsOriginal() {
        RequestContext context = new RequestContext("h", "/api/x", "10.0.0.1", 7);
        context.setPath("/x");

        assertThat(context.getPath()).isEqualTo("/x");
        assertThat(context.getOriginalPath()).isEqualTo("/api/x");
        assertThat(context.getRemoteAddr()).isEqualTo("10.0.0.1");
        assertThat(context.getConnectionSequence()).isEqualTo(7);
    }
}
