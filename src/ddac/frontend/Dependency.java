package ddac.frontend;

/** Edge of the dependency graph: the equation of {@code dependent} references {@code dependency}. */
public record Dependency(String dependent, String dependency) {

  public boolean isSelfLoop() { return dependent.equals(dependency); }

  @Override
  public String toString() {
    return dependent + " -> " + dependency;
  }
}
