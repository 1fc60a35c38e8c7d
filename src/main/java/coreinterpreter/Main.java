package coreinterpreter;

import java.nio.file.FileSystems;

public class Main {
  public static void main(String[] args) {
    Cli cli = new Cli(System.out, System.err, FileSystems.getDefault());
    int status = cli.run(args);
    System.exit(status);
  }
}
