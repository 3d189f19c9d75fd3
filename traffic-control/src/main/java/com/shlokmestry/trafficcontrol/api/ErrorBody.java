package com.shlokmestry.trafficcontrol.api;

public record ErrorBody(String error, String detail) {}
