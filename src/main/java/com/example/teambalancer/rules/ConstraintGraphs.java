package com.example.teambalancer.rules;

public record ConstraintGraphs(ConstraintGraph exclusion, ConstraintGraph cohesion) { }
