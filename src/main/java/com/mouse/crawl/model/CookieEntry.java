package com.mouse.crawl.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CookieEntry {
    private String name;
    private String value;
    private String domain;
    private String path;
    @JsonAlias("expirationDate")
    private Double expires;
    private Boolean httpOnly;
    private Boolean secure;
    private String sameSite;
}
