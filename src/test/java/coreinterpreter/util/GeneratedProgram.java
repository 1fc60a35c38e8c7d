package coreinterpreter.util;

import coreinterpreter.ast.Program;

class GeneratedProgram {
  final Program program;

  GeneratedProgram(Program program) {
    this.program = program;
  }
}
