package io.intellixity.relata.node;

import io.intellixity.relata.schema.View;
import io.intellixity.relata.sql.Dialect;

public final class ViewNode extends LeafNode {
  private final View view;

  public ViewNode(View view) {
    super(view);
    this.view = view;
  }

  public View view() { return view; }

  @Override
  public String toSql(Dialect dialect) {
    return dialect.viewAlias(view(), alias());
  }

  @Override
  public ViewNode as(String alias) {
    super.as(alias);
    return this;
  }

  @Override
  public ViewNode project(String... columns) {
    super.project(columns);
    return this;
  }

  @Override
  public ViewNode clone() {
    return (ViewNode) super.clone();
  }
}
