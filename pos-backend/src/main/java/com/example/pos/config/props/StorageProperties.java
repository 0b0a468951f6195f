package com.example.pos.config.props;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Location of the embedded store. {@code url} wins over {@code path} when set.
 * {@code connectionTimeout} is how long, in milliseconds, a request waits for the store's
 * single connection while another transaction holds it.
 */
@ConfigurationProperties(prefix = "app.storage")
@Validated
public class StorageProperties {
    @NotBlank
    private String path = "pos.db";
    private String url;
    @Min(250)
    private long connectionTimeout = 30000;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public long getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(long connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }
}
