package io.koios.core.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(
    String query,
    String model,
    Double temperature,
    @JsonProperty("enable_internet_search")
    @JsonAlias({"enableInternetSearch"}) Boolean enableInternetSearch
) {
}
