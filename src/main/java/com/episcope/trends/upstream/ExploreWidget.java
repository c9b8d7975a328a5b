package com.episcope.trends.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Widget descriptor from the explore response: the token and request needed to
 * fetch one metric kind's data.
 */
@Value
public class ExploreWidget {
    String id;
    String token;
    JsonNode request;
}
