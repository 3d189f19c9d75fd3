package com.shlokmestry.trafficcontrol.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "traffic.store")
public record StoreProperties(@DefaultValue("true") boolean sharedEnabled) {}
