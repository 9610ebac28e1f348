package com.example.dealdesk.domain;

// Dealer-installed accessory added to the selling price before tax
public record AccessoryItem(String description, double price) {}
