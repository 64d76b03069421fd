package com.raditha.twx.css;

/**
 * Base styles emitted ahead of the utilities unless disabled.
 */
final class Preflight {

    static final String CSS = """
            *, ::before, ::after {
              box-sizing: border-box;
              border-width: 0;
              border-style: solid;
              border-color: #e5e7eb;
            }
            html, :host {
              line-height: 1.5;
              -webkit-text-size-adjust: 100%;
              tab-size: 4;
              font-family: ui-sans-serif, system-ui, sans-serif;
            }
            body {
              margin: 0;
              line-height: inherit;
            }
            hr {
              height: 0;
              color: inherit;
              border-top-width: 1px;
            }
            h1, h2, h3, h4, h5, h6 {
              font-size: inherit;
              font-weight: inherit;
            }
            a {
              color: inherit;
              text-decoration: inherit;
            }
            b, strong {
              font-weight: bolder;
            }
            code, kbd, samp, pre {
              font-family: ui-monospace, SFMono-Regular, Menlo, Monaco, Consolas, monospace;
              font-size: 1em;
            }
            button, input, optgroup, select, textarea {
              font-family: inherit;
              font-size: 100%;
              font-weight: inherit;
              line-height: inherit;
              color: inherit;
              margin: 0;
              padding: 0;
            }
            button, [type='button'], [type='reset'], [type='submit'] {
              -webkit-appearance: button;
              background-color: transparent;
              background-image: none;
            }
            blockquote, dl, dd, h1, h2, h3, h4, h5, h6, hr, figure, p, pre {
              margin: 0;
            }
            ol, ul, menu {
              list-style: none;
              margin: 0;
              padding: 0;
            }
            img, svg, video, canvas, audio, iframe, embed, object {
              display: block;
              vertical-align: middle;
            }
            img, video {
              max-width: 100%;
              height: auto;
            }
            [hidden] {
              display: none;
            }
            """;

    private Preflight() {
    }
}
