package ows;

/** Workshop spelling of identifiers. */
final class Names {

  // Upper-cases the first letter of every run of letters and lower-cases the rest, so
  // "event player" and "EVENT PLAYER" both become "Event Player".
  static String title(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    boolean previousLetter = false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousLetter = true;
      } else {
        sb.append(c);
        previousLetter = false;
      }
    }
    return sb.toString();
  }

  private Names() {}
}
