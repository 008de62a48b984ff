package work.lcod.taskgen.model;

public record Param(String name, String value) {}
