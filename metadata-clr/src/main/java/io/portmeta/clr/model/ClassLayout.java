package io.portmeta.clr.model;

public record ClassLayout(int packingSize, int classSize) {}
