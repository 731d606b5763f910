package com.sitemirror.core.service.export;

final class IndexTemplates {
    private IndexTemplates() {}

    static String css() {
        return """
        <style>
        *{margin:0;padding:0;box-sizing:border-box}
        body{font-family:-apple-system,BlinkMacSystemFont,'Segoe UI',Roboto,Oxygen,Ubuntu,Cantarell,sans-serif;
             background:linear-gradient(135deg,#667eea 0%,#764ba2 100%);min-height:100vh;padding:20px}
        .container{max-width:1200px;margin:0 auto;background:#fff;border-radius:12px;
                   box-shadow:0 20px 60px rgba(0,0,0,.3);overflow:hidden}
        header{background:linear-gradient(135deg,#667eea 0%,#764ba2 100%);color:#fff;padding:40px;text-align:center}
        header h1{font-size:2.5em;margin-bottom:10px}
        header p{opacity:.9;font-size:1.1em;word-break:break-all}
        .stats{padding:20px 40px;background:#f8f9fa;border-bottom:1px solid #e0e0e0;
               display:flex;justify-content:space-around;flex-wrap:wrap}
        .stat{text-align:center}
        .stat-number{font-size:2em;font-weight:bold;color:#667eea}
        .stat-label{color:#666;font-size:.9em}
        .search-box{padding:20px 40px;border-bottom:1px solid #e0e0e0}
        #search-input{width:100%;padding:12px 16px;font-size:16px;border:2px solid #e0e0e0;border-radius:8px;outline:none}
        #search-input:focus{border-color:#667eea}
        .pages{padding:20px 40px 40px}
        .page-item{padding:14px 16px;border-bottom:1px solid #f0f0f0}
        .page-item:hover{background:#f8f9fa}
        .page-item a{color:#333;text-decoration:none;font-size:1.1em;font-weight:500}
        .page-item a:hover{color:#667eea}
        .page-url{color:#999;font-size:.85em;margin-top:4px;word-break:break-all}
        .no-results{display:none;text-align:center;color:#999;padding:40px}
        footer{text-align:center;color:#999;font-size:.85em;padding:20px}
        </style>
        """;
    }

    /** 제목/URL 부분 문자열 검색 (대소문자 무시) */
    static String script() {
        return """
        <script>
        (function(){
          var input = document.getElementById('search-input');
          var items = document.querySelectorAll('.page-item');
          var empty = document.getElementById('no-results');
          input.addEventListener('input', function(){
            var q = input.value.trim().toLowerCase();
            var shown = 0;
            for (var i = 0; i < items.length; i++) {
              var it = items[i];
              var hit = !q
                || it.getAttribute('data-title').indexOf(q) !== -1
                || it.getAttribute('data-url').indexOf(q) !== -1;
              it.style.display = hit ? '' : 'none';
              if (hit) shown++;
            }
            empty.style.display = shown === 0 ? 'block' : 'none';
          });
        })();
        </script>
        """;
    }
}
