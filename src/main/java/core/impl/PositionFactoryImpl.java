package core.impl;

import core.constants.Player;
import core.contracts.PositionFactory;
import core.records.*;

import java.util.List;

public final class PositionFactoryImpl implements PositionFactory {

  @Override
  public GameState newGame(GameConfig config) {
    return GameState.of(config, config.topology().initialOccupancy(), Player.PLAYER_A, 0, null);
  }

  @Override
  public GameState fromText(String text, GameConfig config) {
    String[] parts = text.trim().split("\\s+");
    if (parts.length != 4) {
      throw new IllegalArgumentException("position needs 4 fields (rows, side, moves, chain), got " + parts.length + ": " + text);
    }
    BoardGraph board = config.topology().graph();
    Piece[] cells = new Piece[board.size()];

    // 1. Rows, top to bottom
    String[] rowTexts = parts[0].split("/", -1);
    List<List<Node>> rows = board.rows();
    if (rowTexts.length != rows.size()) {
      throw new IllegalArgumentException("bad rows: expected " + rows.size() + " rows, got " + rowTexts.length);
    }
    for (int r = 0; r < rows.size(); r++) {
      List<Node> row = rows.get(r);
      int col = 0;
      for (char c : rowTexts[r].toCharArray()) {
        if (Character.isDigit(c)) {
          int run = c - '0';
          if (run == 0) throw new IllegalArgumentException("bad rows: zero-length run in row " + (r + 1));
          col += run;
        } else {
          if (col >= row.size()) {
            throw new IllegalArgumentException("bad rows: row " + (r + 1) + " '" + rowTexts[r] + "' is longer than " + row.size() + " nodes");
          }
          Piece p;
          try {
            p = Piece.fromSymbol(c);
          } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("bad rows: " + e.getMessage() + " in row " + (r + 1), e);
          }
          cells[row.get(col++).id()] = p;
        }
      }
      if (col != row.size()) {
        throw new IllegalArgumentException(
                "bad rows: row " + (r + 1) + " '" + rowTexts[r] + "' covers " + col + " nodes, expected " + row.size());
      }
    }

    // 2. Side to move
    if (parts[1].length() != 1) throw new IllegalArgumentException("bad side to move: " + parts[1]);
    Player turn = Player.fromSymbol(parts[1].charAt(0));

    // 3. Completed moves
    int moveCount;
    try {
      moveCount = Integer.parseInt(parts[2]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad move count: " + parts[2], e);
    }
    if (moveCount < 0) throw new IllegalArgumentException("bad move count: " + parts[2]);

    // 4. Pending chain
    PendingChain chain = null;
    if (!parts[3].equals("-")) {
      Node at = board.findNode(parts[3])
              .orElseThrow(() -> new IllegalArgumentException("bad chain node: " + parts[3]));
      Piece p = cells[at.id()];
      if (p == null || p.owner() != turn) {
        throw new IllegalArgumentException("bad chain node: " + parts[3] + " holds no piece of the side to move");
      }
      chain = new PendingChain(at, p.rank(), p.owner());
    }

    return GameState.of(config, cells, turn, moveCount, chain);
  }

  @Override
  public String toText(GameState state) {
    StringBuilder sb = new StringBuilder(64);
    List<List<Node>> rows = state.board().rows();
    for (int r = 0; r < rows.size(); r++) {
      int empty = 0;
      for (Node n : rows.get(r)) {
        Piece p = state.at(n.id());
        if (p == null) {
          empty++;
          continue;
        }
        if (empty != 0) {
          sb.append(empty);
          empty = 0;
        }
        sb.append(p.symbol());
      }
      if (empty != 0) sb.append(empty);
      if (r != rows.size() - 1) sb.append('/');
    }
    sb.append(' ').append(state.turn().symbol());
    sb.append(' ').append(state.moveCount());
    sb.append(' ').append(state.pendingChain().map(c -> c.node().label()).orElse("-"));
    return sb.toString();
  }
}
